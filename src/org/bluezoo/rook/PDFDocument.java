/*
 * PDFDocument.java
 * Copyright (C) 2025 Chris Burdess
 *
 * This file is part of Rook, a PDF object model and resolution engine.
 *
 * Rook is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * Rook is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with Rook.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.rook;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An open PDF file and everything needed to resolve its objects.
 * <p>
 * Opening a document reads only its structure: the header, the
 * cross-reference sections reached from startxref, the trailer, the
 * document catalog, the information dictionary and the root of the page
 * tree. Other objects are read when first dereferenced and kept in a
 * bounded cache. If the cross-reference data is unusable the file is
 * scanned for object headers and the table rebuilt; this happens at
 * most once per document.
 * <p>
 * Objects handed out by this class are counted for the caller, who
 * must release them (or close them). Objects obtained through
 * {@link #getTrailer}, {@link #getCatalog} and {@link #getInfo} are owned
 * by the document and must not be released.
 * <p>
 * A document is not safe for use by multiple threads.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class PDFDocument implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(PDFDocument.class);

    /** The largest object number accepted. */
    static final int MAX_OBJECT_NUMBER = 8388607;

    private static final byte[] HEADER = "%PDF-".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] STARTXREF = "startxref".getBytes(StandardCharsets.US_ASCII);

    private final PDFSource source;
    private final PDFOptions options;
    private final ObjectAllocator allocator;
    private final PDFDiagnostics diagnostics;
    private final PDFTokenReader tokenReader;
    private final ObjectStack stack;
    private final ObjectParser parser;
    private final LoopDetector loopDetector = new LoopDetector();
    private final Map<Integer, ObjectStream> objectStreams;

    private CrossReferenceTable xref;
    private ObjectCache cache;
    private PDFDictionary trailer;
    private PDFDictionary catalog;
    private PDFDictionary info;
    private PageTree pageTree;
    private String version;
    private long headerOffset;
    private int repairCatalogNumber = -1;
    private boolean hybrid;
    private boolean repaired;
    private boolean cancelled;
    private boolean closed;

    /**
     * Opens a file with default options.
     *
     * @param path the file
     * @return the document
     * @throws PDFParseException if the file cannot be interpreted
     * @throws IOException if the file cannot be read
     */
    public static PDFDocument open(Path path) throws IOException {
        return open(path, new PDFOptions());
    }

    public static PDFDocument open(Path path, PDFOptions options) throws IOException {
        return open(Files.newByteChannel(path, StandardOpenOption.READ), options);
    }

    /**
     * Opens a document on a channel. The document takes ownership of the
     * channel and closes it when it is closed, or when opening fails.
     *
     * @param channel the channel
     * @param options processing options
     * @return the document
     * @throws PDFParseException if the file cannot be interpreted
     * @throws IOException if the channel cannot be read
     */
    public static PDFDocument open(SeekableByteChannel channel, PDFOptions options) throws IOException {
        PDFSource source;
        try {
            source = PDFSource.open(channel);
        } catch (IOException | RuntimeException e) {
            channel.close();
            throw e;
        }
        PDFDocument document = new PDFDocument(source, options);
        boolean loaded = false;
        try {
            document.load();
            loaded = true;
            return document;
        } finally {
            if (!loaded) {
                document.close();
            }
        }
    }

    /**
     * Opens a document held in memory.
     *
     * @param data the file contents
     * @param options processing options
     * @return the document
     * @throws PDFParseException if the data cannot be interpreted
     */
    public static PDFDocument open(ByteBuffer data, PDFOptions options) throws IOException {
        PDFDocument document = new PDFDocument(PDFSource.wrap(data), options);
        boolean loaded = false;
        try {
            document.load();
            loaded = true;
            return document;
        } finally {
            if (!loaded) {
                document.close();
            }
        }
    }

    PDFDocument(PDFSource source, PDFOptions options) {
        this.source = source;
        this.options = options;
        this.allocator = new ObjectAllocator();
        this.diagnostics = new PDFDiagnostics(options.isStopOnError(), options.getErrorHandler());
        this.tokenReader = new PDFTokenReader(allocator, diagnostics);
        this.stack = new ObjectStack(allocator, options.getMaxStackDepth());
        this.parser = new ObjectParser(this, tokenReader, stack, diagnostics);
        final int objectStreamCacheSize = options.getObjectStreamCacheSize();
        this.objectStreams = new LinkedHashMap<Integer, ObjectStream>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<Integer, ObjectStream> eldest) {
                return size() > objectStreamCacheSize;
            }
        };
    }

    // -- Accessors --

    public ObjectAllocator getAllocator() {
        return allocator;
    }

    public PDFDiagnostics getDiagnostics() {
        return diagnostics;
    }

    public PDFOptions getOptions() {
        return options;
    }

    PDFSource getSource() {
        return source;
    }

    ObjectParser getObjectParser() {
        return parser;
    }

    /**
     * Returns the trailer dictionary. It is owned by the document.
     */
    public PDFDictionary getTrailer() {
        return trailer;
    }

    /**
     * Returns the document catalog. It is owned by the document.
     */
    public PDFDictionary getCatalog() {
        return catalog;
    }

    /**
     * Returns the document information dictionary, or null. It is owned
     * by the document.
     */
    public PDFDictionary getInfo() {
        return info;
    }

    /**
     * Returns the version from the file header, such as "1.7", or null
     * if the header had none.
     */
    public String getVersion() {
        return version;
    }

    /**
     * Returns the number of entries in the cross-reference table.
     */
    public int getXRefSize() {
        return xref.size();
    }

    public boolean isRepaired() {
        return repaired;
    }

    /**
     * Indicates whether the file has both a classic cross-reference table
     * and a cross-reference stream.
     */
    public boolean isHybrid() {
        return hybrid;
    }

    /**
     * Returns the number of objects currently cached.
     */
    public int getCachedObjectCount() {
        return cache.size();
    }

    // -- Opening --

    private void load() throws IOException {
        readHeader();
        long startxref = locateXRef();
        if (startxref < 0L || !tryReadXRef(startxref, options.isPreferXRefStream())) {
            repair();
        }
        try {
            readStructure();
        } catch (PDFParseException e) {
            if (diagnostics.isStopOnError()) {
                throw e;
            }
            if (hybrid && options.isPreferXRefStream() && !repaired) {
                diagnostics.record(PDFErrorKind.BAD_XREF_STREAM,
                        "Structure unreadable through cross-reference stream: " + e.getMessage());
                LOGGER.debug("Retrying hybrid file with its classic cross-reference table");
                if (tryReadXRef(startxref, false) && tryReadStructure()) {
                    return;
                }
            }
            if (repaired) {
                throw e;
            }
            LOGGER.debug("Document structure unreadable, repairing: {}", e.getMessage());
            repair();
            readStructure();
        }
    }

    private void readHeader() throws IOException {
        int n = (int) Math.min(options.getHeaderSearchSize(), source.size());
        byte[] buf = new byte[n];
        source.seek(0L);
        int len = Math.max(source.read(buf, 0, n), 0);
        int i = indexOf(buf, len, HEADER, 0);
        if (i < 0) {
            diagnostics.record(PDFErrorKind.NO_HEADER, "No %PDF- in the first " + n + " bytes", 0L);
            return;
        }
        headerOffset = i;
        int j = i + HEADER.length;
        int start = j;
        while (j < len && (isDigit(buf[j]) || buf[j] == '.')) {
            j++;
        }
        String candidate = new String(buf, start, j - start, StandardCharsets.US_ASCII);
        if (candidate.matches("\\d+\\.\\d+")) {
            version = candidate;
            LOGGER.debug("PDF version {} at offset {}", version, headerOffset);
        } else {
            diagnostics.record(PDFErrorKind.NO_HEADER_VERSION, "Header at offset " + i, i);
        }
    }

    /**
     * Finds the last startxref keyword and returns the offset after it,
     * or -1 with the condition recorded.
     */
    private long locateXRef() throws IOException {
        long keyword = findStartxref();
        if (keyword < 0L) {
            diagnostics.record(PDFErrorKind.NO_STARTXREF, "No startxref keyword", -1L);
            return -1L;
        }
        source.seek(keyword + STARTXREF.length);
        source.skipWhitespace();
        long value = 0L;
        int digits = 0;
        int c;
        while ((c = source.peek()) >= '0' && c <= '9' && digits < 19) {
            source.read();
            value = value * 10 + (c - '0');
            digits++;
        }
        if (digits == 0 || value <= 0L || value >= source.size()) {
            diagnostics.record(PDFErrorKind.BAD_STARTXREF, "startxref at " + keyword, keyword);
            return -1L;
        }
        return value;
    }

    /**
     * Searches backwards from the end of the file in chunks. Successive
     * chunks overlap by one byte less than the keyword, so a keyword
     * split across a chunk boundary is still found.
     */
    private long findStartxref() throws IOException {
        int chunkSize = options.getStartxrefChunkSize();
        byte[] buf = new byte[chunkSize];
        long end = source.size();
        while (end > 0L) {
            long start = Math.max(0L, end - chunkSize);
            source.seek(start);
            int len = Math.max(source.read(buf, 0, (int) (end - start)), 0);
            int last = -1;
            for (int i = indexOf(buf, len, STARTXREF, 0); i >= 0; i = indexOf(buf, len, STARTXREF, i + 1)) {
                last = i;
            }
            if (last >= 0) {
                return start + last;
            }
            if (start == 0L) {
                break;
            }
            end = start + STARTXREF.length - 1;
        }
        return -1L;
    }

    private boolean tryReadXRef(long startxref, boolean preferXRefStream) throws IOException {
        resetXRef();
        XRefReader reader = new XRefReader(this, xref, preferXRefStream);
        try {
            try {
                reader.read(startxref);
            } finally {
                trailer = reader.takeTrailer();
                hybrid = reader.isHybrid();
            }
            if (trailer == null) {
                throw new PDFSyntaxException("No trailer found", startxref);
            }
            LOGGER.debug("Cross-reference table has {} entries", xref.size());
            return true;
        } catch (PDFParseException e) {
            if (diagnostics.isStopOnError()) {
                throw e;
            }
            diagnostics.record(PDFErrorKind.BAD_XREF, e.getMessage(), startxref);
            return false;
        }
    }

    private void resetXRef() {
        objectStreams.clear();
        if (cache != null) {
            cache.clear();
        }
        if (xref != null) {
            xref.release();
        }
        if (trailer != null) {
            trailer.release();
            trailer = null;
        }
        xref = allocator.allocXRef(0);
        xref.retain();
        cache = new ObjectCache(xref, options.getCacheSize());
    }

    private boolean tryReadStructure() throws IOException {
        try {
            readStructure();
            return true;
        } catch (PDFParseException e) {
            LOGGER.debug("Classic cross-reference table did not help: {}", e.getMessage());
            return false;
        }
    }

    private void readStructure() throws IOException {
        releaseStructure();
        if (trailer == null) {
            throw new PDFUndefinedException("Document has no trailer");
        }
        if (trailer.knownNoDeref("Encrypt")) {
            throw new PDFParseException("Encrypted documents are not supported");
        }
        readCatalog();
        readInfo();
        PDFDictionary pages = dictGetDictionary(catalog, "Pages");
        pageTree = new PageTree(this, pages);
    }

    private void readCatalog() throws IOException {
        PDFParseException failure = null;
        if (trailer.knownNoDeref("Root")) {
            try {
                PDFDictionary root = dictGetDictionary(trailer, "Root");
                if (root.isName("Type", "Catalog") || !root.knownNoDeref("Type")) {
                    catalog = root;
                    return;
                }
                root.release();
                failure = new PDFTypeCheckException("/Root is not a /Catalog");
            } catch (PDFParseException e) {
                failure = e;
            }
        }
        if (repairCatalogNumber > 0) {
            PDFObject candidate = dereference(repairCatalogNumber, 0);
            if (candidate instanceof PDFDictionary) {
                LOGGER.debug("Using catalog found during repair, object {}", repairCatalogNumber);
                catalog = (PDFDictionary) candidate;
                return;
            }
            candidate.release();
        }
        if (failure != null) {
            throw failure;
        }
        throw new PDFUndefinedException("Trailer has no /Root");
    }

    private void readInfo() throws IOException {
        if (!trailer.knownNoDeref("Info")) {
            return;
        }
        try {
            info = dictGetDictionary(trailer, "Info");
        } catch (PDFParseException e) {
            if (diagnostics.isStopOnError()) {
                throw e;
            }
            diagnostics.record(PDFErrorKind.BAD_INFO, e.getMessage());
        }
    }

    private void releaseStructure() {
        if (pageTree != null) {
            pageTree.dispose();
            pageTree = null;
        }
        if (catalog != null) {
            catalog.release();
            catalog = null;
        }
        if (info != null) {
            info.release();
            info = null;
        }
    }

    // -- Repair --

    /**
     * Rebuilds the cross-reference table by scanning the file. Objects
     * are first located by their headers; every object found is then
     * read, so that object streams can contribute their members and the
     * catalog can be found if the trailer is lost.
     */
    private void repair() throws IOException {
        if (repaired) {
            throw new IllegalStateException("Document already repaired");
        }
        repaired = true;
        diagnostics.record(PDFErrorKind.REPAIRED, "Rebuilding cross-reference table", -1L);
        PDFDictionary previousTrailer = trailer;
        trailer = null;
        resetXRef();
        RepairScanner scanner = new RepairScanner(source, headerOffset);
        int found = 0;
        try {
            while (scanner.hasNext()) {
                RepairScanner.Discovery d = scanner.next();
                if (d.getObjectNumber() >= xref.size()) {
                    xref.grow(d.getObjectNumber() + 1);
                }
                xref.setEntry(CrossReferenceEntry.inUse(d.getObjectNumber(), d.getOffset(), d.getGeneration()));
                found++;
            }
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        LOGGER.info("Repair found {} objects", found);
        PDFDictionary xrefStreamDict = null;
        int catalogNumber = -1;
        try {
            for (int num = 1; num < xref.size(); num++) {
                CrossReferenceEntry entry = xref.lookup(num);
                if (entry == null || !entry.isInUse()) {
                    continue;
                }
                PDFObject obj = readForRepair(num, entry.getGeneration());
                if (obj == null) {
                    continue;
                }
                try {
                    if (obj instanceof PDFDictionary) {
                        PDFDictionary dict = (PDFDictionary) obj;
                        if (dict.isStream() && dict.isName("Type", "ObjStm")) {
                            registerObjectStreamMembers(num);
                        } else if (dict.isName("Type", "Catalog")) {
                            catalogNumber = num;
                        } else if (dict.isStream() && dict.isName("Type", "XRef")) {
                            if (xrefStreamDict != null) {
                                xrefStreamDict.release();
                            }
                            xrefStreamDict = (PDFDictionary) dict.retain();
                        }
                    }
                } finally {
                    obj.release();
                }
            }
            // members may shadow objects read above
            cache.clear();
            if (catalogNumber < 0) {
                catalogNumber = findCompressedCatalog();
            }
            trailer = findTrailer(scanner.getTrailerOffsets());
            if (trailer == null && xrefStreamDict != null) {
                trailer = (PDFDictionary) xrefStreamDict.retain();
            }
            if (trailer == null && previousTrailer != null) {
                trailer = (PDFDictionary) previousTrailer.retain();
            }
            if (trailer == null) {
                trailer = allocator.allocDictionary(2);
                trailer.retain();
            }
        } finally {
            if (xrefStreamDict != null) {
                xrefStreamDict.release();
            }
            if (previousTrailer != null) {
                previousTrailer.release();
            }
        }
        repairCatalogNumber = catalogNumber;
        LOGGER.debug("Repaired table has {} entries, catalog {}", xref.size(), catalogNumber);
    }

    private PDFObject readForRepair(int num, int generation) throws IOException {
        try {
            return dereference(num, generation);
        } catch (PDFParseException e) {
            if (diagnostics.isStopOnError()) {
                throw e;
            }
            LOGGER.debug("Repair skipped object {}: {}", num, e.getMessage());
            return null;
        }
    }

    private void registerObjectStreamMembers(int streamNumber) throws IOException {
        ObjectStream os;
        try {
            os = getObjectStream(streamNumber);
        } catch (PDFParseException e) {
            if (diagnostics.isStopOnError()) {
                throw e;
            }
            LOGGER.debug("Repair skipped object stream {}: {}", streamNumber, e.getMessage());
            return;
        }
        for (int i = 0; i < os.getObjectCount(); i++) {
            int member = os.getObjectNumber(i);
            if (member <= 0 || member > MAX_OBJECT_NUMBER || member == streamNumber) {
                continue;
            }
            if (member >= xref.size()) {
                xref.grow(member + 1);
            }
            xref.setEntry(CrossReferenceEntry.compressed(member, streamNumber, i));
        }
    }

    private int findCompressedCatalog() throws IOException {
        for (int num = 1; num < xref.size(); num++) {
            CrossReferenceEntry entry = xref.lookup(num);
            if (entry == null || !entry.isCompressed()) {
                continue;
            }
            PDFObject obj = readForRepair(num, 0);
            if (obj == null) {
                continue;
            }
            try {
                if (obj instanceof PDFDictionary && ((PDFDictionary) obj).isName("Type", "Catalog")) {
                    return num;
                }
            } finally {
                obj.release();
            }
        }
        return -1;
    }

    private PDFDictionary findTrailer(List<Long> offsets) throws IOException {
        for (int i = offsets.size() - 1; i >= 0; i--) {
            source.seek(offsets.get(i));
            PDFObject value;
            try {
                value = parser.readValue(source);
            } catch (PDFParseException e) {
                LOGGER.debug("Unreadable trailer at {}: {}", offsets.get(i), e.getMessage());
                continue;
            }
            if (value instanceof PDFDictionary) {
                return (PDFDictionary) value;
            }
            value.release();
        }
        return null;
    }

    // -- Resolution --

    /**
     * Returns the object with the given number.
     * <p>
     * Free and undefined entries read as null. While a resolution chain
     * is being followed, asking for an object already on the chain is an
     * error.
     *
     * @param objectNumber the object number
     * @param generation the generation number (not checked)
     * @return the object, counted for the caller
     * @throws PDFRangeCheckException if the number is outside the table
     * @throws CircularReferenceException if the object is being resolved
     * @throws PDFParseException if the object cannot be read
     * @throws IOException if the file cannot be read
     */
    public PDFObject dereference(int objectNumber, int generation) throws IOException {
        checkOpen();
        if (objectNumber < 0 || objectNumber >= xref.size()) {
            diagnostics.note(PDFErrorKind.BAD_OBJECT_NUMBER, "Object " + objectNumber, -1L);
            throw new PDFRangeCheckException("Unknown object " + objectNumber
                    + " (table size " + xref.size() + ")");
        }
        CrossReferenceEntry entry = xref.lookup(objectNumber);
        if (objectNumber == 0 || entry == null || entry.isFree()) {
            return allocator.getNull().retain();
        }
        if (loopDetector.contains(objectNumber)) {
            diagnostics.note(PDFErrorKind.CIRCULAR_REFERENCE, "Object " + objectNumber, -1L);
            throw new CircularReferenceException("Circular reference to object " + objectNumber);
        }
        PDFObject result = cache.get(entry);
        if (result != null) {
            result.retain();
        } else {
            long saved = source.position();
            loopDetector.mark();
            loopDetector.add(objectNumber);
            try {
                if (entry.isCompressed()) {
                    result = readCompressedObject(objectNumber, generation, entry);
                } else {
                    source.seek(entry.getOffset());
                    result = parser.readObject(source, objectNumber);
                }
            } finally {
                loopDetector.clearToMark();
                source.seek(saved);
            }
            cache.put(entry, result);
        }
        if (loopDetector.isActive()) {
            loopDetector.add(objectNumber);
        }
        return result;
    }

    /**
     * Follows references until a direct value is reached.
     *
     * @param value a value, possibly a reference
     * @param containerNumber the number of the object holding the value,
     *        or 0; it counts as being resolved
     * @return the direct value, counted for the caller
     */
    public PDFObject resolve(PDFObject value, int containerNumber) throws IOException {
        if (!(value instanceof PDFIndirectReference)) {
            return value.retain();
        }
        int[] followed = new int[4];
        int count = 0;
        loopDetector.mark();
        PDFObject current;
        try {
            loopDetector.add(containerNumber);
            current = value.retain();
            while (current instanceof PDFIndirectReference) {
                PDFIndirectReference ref = (PDFIndirectReference) current;
                PDFObject next;
                try {
                    next = dereference(ref.getTargetNumber(), ref.getTargetGeneration());
                } finally {
                    current.release();
                }
                if (count == followed.length) {
                    followed = Arrays.copyOf(followed, count * 2);
                }
                followed[count++] = ref.getTargetNumber();
                current = next;
            }
        } finally {
            loopDetector.clearToMark();
        }
        // an enclosing scope keeps what this chain passed through
        if (loopDetector.isActive()) {
            for (int i = 0; i < count; i++) {
                loopDetector.add(followed[i]);
            }
        }
        return current;
    }

    /**
     * Opens a loop detection scope. Until the matching
     * {@link #loopDetectorClearToMark}, every object dereferenced or
     * resolved through this document is remembered, and reaching any of
     * them again raises {@link CircularReferenceException}. Scopes nest.
     */
    public void loopDetectorMark() {
        checkOpen();
        loopDetector.mark();
    }

    /**
     * Adds an object number to the innermost open scope, typically the
     * object a walk starts from.
     *
     * @param objectNumber the object number; 0 or less is ignored
     */
    public void loopDetectorAdd(int objectNumber) {
        checkOpen();
        loopDetector.add(objectNumber);
    }

    /**
     * Closes the innermost scope opened by {@link #loopDetectorMark}.
     */
    public void loopDetectorClearToMark() {
        checkOpen();
        loopDetector.clearToMark();
    }

    private PDFObject readCompressedObject(int objectNumber, int generation, CrossReferenceEntry entry)
            throws IOException {
        ObjectStream os = getObjectStream(entry.getObjectStreamNumber());
        int index = entry.getIndexInStream();
        if (index < 0 || index >= os.getObjectCount()) {
            throw new PDFRangeCheckException("Index " + index + " outside object stream "
                    + os.getStreamNumber());
        }
        if (os.getObjectNumber(index) != objectNumber) {
            int found = os.indexOf(objectNumber);
            if (found < 0) {
                throw new PDFUndefinedException("Object " + objectNumber + " is not in object stream "
                        + os.getStreamNumber());
            }
            LOGGER.debug("Object {} found at index {} of object stream {}, not {}",
                    objectNumber, found, os.getStreamNumber(), index);
            index = found;
        }
        PDFSource src = os.open();
        src.seek(os.getObjectStartOffset(index));
        PDFObject value = parser.readValue(src);
        if (!(value instanceof PDFNull)) {
            value.bind(objectNumber, generation);
        }
        return value;
    }

    private ObjectStream getObjectStream(int streamNumber) throws IOException {
        ObjectStream os = objectStreams.get(streamNumber);
        if (os != null) {
            return os;
        }
        if (streamNumber <= 0 || streamNumber >= xref.size()) {
            throw new PDFRangeCheckException("Unknown object stream " + streamNumber);
        }
        CrossReferenceEntry entry = xref.lookup(streamNumber);
        PDFObject obj = dereference(streamNumber, entry == null ? 0 : entry.getGeneration());
        try {
            if (!(obj instanceof PDFDictionary) || !((PDFDictionary) obj).isStream()) {
                throw new PDFSyntaxException("Object stream " + streamNumber + " is not a stream");
            }
            PDFDictionary dict = (PDFDictionary) obj;
            if (!dict.isName("Type", "ObjStm")) {
                throw new PDFSyntaxException("Object " + streamNumber + " is not /Type /ObjStm");
            }
            long n = dictGetInteger(dict, "N");
            long first = dictGetInteger(dict, "First");
            if (n < 0L || n > MAX_OBJECT_NUMBER || first < 0L) {
                throw new PDFRangeCheckException("Object stream " + streamNumber + " has bad /N or /First");
            }
            ByteBuffer data = readStream(dict);
            if (first > data.limit()) {
                throw new PDFRangeCheckException("Object stream " + streamNumber + " /First past end of data");
            }
            int[] objectNumbers = new int[(int) n];
            int[] offsets = new int[(int) n];
            PDFSource src = PDFSource.wrap(data);
            int base = stack.size();
            try {
                for (int i = 0; i < n; i++) {
                    objectNumbers[i] = readHeaderInteger(src, streamNumber);
                    offsets[i] = readHeaderInteger(src, streamNumber);
                }
            } finally {
                stack.popTo(base);
            }
            os = new ObjectStream(streamNumber, data, (int) first, objectNumbers, offsets);
            objectStreams.put(streamNumber, os);
            LOGGER.debug("Loaded object stream {} with {} objects", streamNumber, n);
            return os;
        } finally {
            obj.release();
        }
    }

    private int readHeaderInteger(PDFSource src, int streamNumber) throws IOException {
        if (!tokenReader.readToken(src, stack) || !(stack.peek(0) instanceof PDFInteger)) {
            throw new PDFSyntaxException("Bad header in object stream " + streamNumber);
        }
        long value = ((PDFInteger) stack.peek(0)).longValue();
        stack.pop();
        if (value < 0L || value > Integer.MAX_VALUE) {
            throw new PDFRangeCheckException("Bad header value " + value + " in object stream " + streamNumber);
        }
        return (int) value;
    }

    /**
     * Reads and decodes the data of a stream.
     *
     * @param dict the stream dictionary
     * @return the decoded data
     * @throws PDFTypeCheckException if the dictionary is not a stream
     * @throws IOException if the data cannot be read or decoded
     */
    public ByteBuffer readStream(PDFDictionary dict) throws IOException {
        if (!dict.isStream()) {
            throw new PDFTypeCheckException("Object " + dict.getObjectNumber() + " is not a stream");
        }
        long length = dict.getStreamLength();
        if (length > Integer.MAX_VALUE - 8) {
            throw new PDFRangeCheckException("Stream too long: " + length);
        }
        byte[] raw = new byte[(int) length];
        long saved = source.position();
        int n;
        try {
            source.seek(dict.getStreamOffset());
            n = Math.max(source.read(raw, 0, raw.length), 0);
        } finally {
            source.seek(saved);
        }
        if (n < raw.length) {
            raw = Arrays.copyOf(raw, n);
        }
        PDFObject filter = dictKnownGet(dict, "Filter");
        PDFObject decodeParms = null;
        try {
            if (filter == null) {
                return ByteBuffer.wrap(raw).asReadOnlyBuffer();
            }
            decodeParms = dictKnownGet(dict, "DecodeParms");
            ByteBufferCollector out = new ByteBufferCollector(Math.max(raw.length * 2, 64));
            FilterPipeline pipeline = FilterPipeline.create(filter, decodeParms, out);
            for (String name : pipeline.getUnsupportedFilters()) {
                diagnostics.record(PDFErrorKind.UNKNOWN_FILTER, name + " in object " + dict.getObjectNumber(),
                        dict.getStreamOffset());
            }
            pipeline.write(ByteBuffer.wrap(raw));
            pipeline.close();
            return out.toByteBuffer();
        } finally {
            if (filter != null) {
                filter.release();
            }
            if (decodeParms != null) {
                decodeParms.release();
            }
        }
    }

    // -- Typed access --

    /**
     * Returns a dictionary value with references resolved, or null if
     * the key is absent.
     */
    public PDFObject dictKnownGet(PDFDictionary dict, String key) throws IOException {
        PDFObject value = dict.getNoDeref(key);
        return value == null ? null : resolve(value, dict.getObjectNumber());
    }

    /**
     * Returns a dictionary value with references resolved.
     *
     * @throws PDFUndefinedException if the key is absent
     */
    public PDFObject dictGet(PDFDictionary dict, String key) throws IOException {
        PDFObject value = dictKnownGet(dict, key);
        if (value == null) {
            throw new PDFUndefinedException("Missing /" + key + " in object " + dict.getObjectNumber());
        }
        return value;
    }

    /**
     * Returns a dictionary value of the given class with references
     * resolved.
     *
     * @throws PDFUndefinedException if the key is absent
     * @throws PDFTypeCheckException if the value has another type
     */
    public <T extends PDFObject> T dictGetType(PDFDictionary dict, String key, Class<T> type)
            throws IOException {
        PDFObject value = dictGet(dict, key);
        if (!type.isInstance(value)) {
            PDFObjectType actual = value.getType();
            value.release();
            throw new PDFTypeCheckException("/" + key + " in object " + dict.getObjectNumber()
                    + " is " + actual + ", expected " + type.getSimpleName());
        }
        return type.cast(value);
    }

    public long dictGetInteger(PDFDictionary dict, String key) throws IOException {
        try (PDFInteger value = dictGetType(dict, key, PDFInteger.class)) {
            return value.longValue();
        }
    }

    public double dictGetNumber(PDFDictionary dict, String key) throws IOException {
        try (PDFNumber value = dictGetType(dict, key, PDFNumber.class)) {
            return value.doubleValue();
        }
    }

    public PDFName dictGetName(PDFDictionary dict, String key) throws IOException {
        return dictGetType(dict, key, PDFName.class);
    }

    public PDFDictionary dictGetDictionary(PDFDictionary dict, String key) throws IOException {
        return dictGetType(dict, key, PDFDictionary.class);
    }

    public PDFArray dictGetArray(PDFDictionary dict, String key) throws IOException {
        return dictGetType(dict, key, PDFArray.class);
    }

    /**
     * Returns an array element with references resolved.
     *
     * @throws PDFRangeCheckException if the index is out of range
     */
    public PDFObject arrayGet(PDFArray array, int index) throws IOException {
        return resolve(array.getNoDeref(index), array.getObjectNumber());
    }

    // -- Pages --

    public int getPageCount() {
        checkOpen();
        return pageTree.getPageCount();
    }

    /**
     * Returns a page dictionary with inherited attributes merged in.
     *
     * @param index the zero-based page index
     * @return the page, counted for the caller
     * @throws PDFRangeCheckException if there is no such page
     */
    public PDFDictionary getPageDictionary(int index) throws IOException {
        checkOpen();
        return pageTree.getPage(index);
    }

    /**
     * Hands each content stream of a page to an interpreter.
     *
     * @param index the zero-based page index
     * @param interpreter the interpreter
     */
    public void processPageContents(int index, ContentStreamInterpreter interpreter) throws IOException {
        PDFDictionary page = getPageDictionary(index);
        try {
            PDFObject contents = page.getNoDeref("Contents");
            if (contents == null) {
                return;
            }
            int pageNumber = page.getObjectNumber();
            PDFObject resolved = resolve(contents, pageNumber);
            try {
                if (resolved instanceof PDFArray) {
                    PDFArray array = (PDFArray) resolved;
                    for (int i = 0; i < array.size(); i++) {
                        PDFObject stream = resolve(array.getNoDeref(i), pageNumber);
                        try {
                            interpretStream(stream, page, interpreter);
                        } finally {
                            stream.release();
                        }
                    }
                } else {
                    interpretStream(resolved, page, interpreter);
                }
            } finally {
                resolved.release();
            }
        } finally {
            page.release();
        }
    }

    private void interpretStream(PDFObject stream, PDFDictionary page, ContentStreamInterpreter interpreter)
            throws IOException {
        if (!(stream instanceof PDFDictionary) || !((PDFDictionary) stream).isStream()) {
            throw new PDFTypeCheckException("Page content is " + stream.getType() + ", not a stream");
        }
        interpreter.interpretContentStream(this, (PDFDictionary) stream, page);
    }

    /**
     * Processes the pages selected by the first and last page options.
     * An error on one page is recorded and processing continues with the
     * next, unless stop-on-error is set.
     *
     * @param interpreter the interpreter
     * @return the number of pages processed without error
     */
    public int processPages(ContentStreamInterpreter interpreter) throws IOException {
        checkOpen();
        int first = Math.max(options.getFirstPage(), 1);
        int last = Math.min(options.getLastPage(), getPageCount());
        int processed = 0;
        cancelled = false;
        for (int page = first; page <= last && !cancelled; page++) {
            try {
                processPageContents(page - 1, interpreter);
                processed++;
            } catch (PDFParseException e) {
                if (diagnostics.isStopOnError()) {
                    throw e;
                }
                diagnostics.record(PDFErrorKind.PAGE_ERROR, "Page " + page + ": " + e.getMessage());
            }
        }
        return processed;
    }

    /**
     * Stops {@link #processPages} before the next page.
     */
    public void cancel() {
        cancelled = true;
    }

    // -- Closing --

    /**
     * Returns the /Producer of the information dictionary, or null.
     */
    public String getProducer() throws IOException {
        if (info == null) {
            return null;
        }
        PDFObject value = dictKnownGet(info, "Producer");
        if (value == null) {
            return null;
        }
        try {
            return value instanceof PDFString ? ((PDFString) value).getText() : null;
        } finally {
            value.release();
        }
    }

    /**
     * Returns the report of every condition recorded so far.
     */
    public List<String> getReport() {
        String producer = null;
        if (!closed && xref != null) {
            try {
                producer = getProducer();
            } catch (IOException | PDFParseException e) {
                LOGGER.debug("No producer for report: {}", e.getMessage());
            }
        }
        return diagnostics.report(producer);
    }

    /**
     * Logs the report, then releases every object the document holds
     * and closes the file.
     */
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        try {
            for (String line : getReport()) {
                LOGGER.info(line);
            }
        } finally {
            closed = true;
            releaseStructure();
            if (trailer != null) {
                trailer.release();
                trailer = null;
            }
            objectStreams.clear();
            if (cache != null) {
                cache.clear();
            }
            if (xref != null) {
                xref.release();
            }
            stack.clear();
            loopDetector.reset();
            source.close();
            LOGGER.debug("Closed document, {} objects still allocated", allocator.liveCount());
        }
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("Document is closed");
        }
    }

    private static boolean isDigit(byte b) {
        return b >= '0' && b <= '9';
    }

    private static int indexOf(byte[] buf, int len, byte[] pattern, int from) {
        outer:
        for (int i = from; i <= len - pattern.length; i++) {
            for (int j = 0; j < pattern.length; j++) {
                if (buf[i + j] != pattern[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }

}
