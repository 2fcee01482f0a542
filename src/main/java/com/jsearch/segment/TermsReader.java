package com.jsearch.segment;

import com.jsearch.common.IndexConstants;
import com.jsearch.common.errors.CorruptIndexException;
import com.jsearch.common.io.IndexInput;

import java.io.Closeable;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Loads the term dictionaries of a segment into memory and reads postings
 * lists on demand from {@code postings.dat}.
 */
public class TermsReader implements Closeable {
    private final Path postingsPath;
    private final FileChannel postings;
    private final Map<Integer, TermDictionary> dictionaries;

    public TermsReader(Path directory) throws IOException {
        this.dictionaries = Collections.unmodifiableMap(
            readDictionaries(directory.resolve(IndexConstants.TERMS_FILE)));
        this.postingsPath = directory.resolve(IndexConstants.POSTINGS_FILE);
        this.postings = FileChannel.open(postingsPath, StandardOpenOption.READ);
        try {
            IndexInput.verifyChannel(postingsPath, postings, TermsWriter.POSTINGS_FILE_TYPE);
        } catch (IOException e) {
            postings.close();
            throw e;
        }
    }

    /**
     * @return The dictionary of the field, or null if the segment has no terms for it
     */
    public TermDictionary dictionary(int fieldOrdinal) {
        return dictionaries.get(fieldOrdinal);
    }

    public Postings postings(TermDictionary dictionary, int termIndex) throws IOException {
        IndexInput in = IndexInput.slice(postingsPath, postings,
            dictionary.postingsOffset(termIndex), dictionary.postingsLength(termIndex));
        int docCount = in.readVInt();
        if (docCount != dictionary.docFreq(termIndex)) {
            throw new CorruptIndexException("Postings doc count " + docCount + " does not match doc freq "
                + dictionary.docFreq(termIndex) + " for term '" + dictionary.term(termIndex) + "'", postingsPath);
        }
        int[] docs = new int[docCount];
        int[] freqs = new int[docCount];
        int[] starts = new int[docCount + 1];
        IntArrayBuffer positions = new IntArrayBuffer(docCount * 2);
        int doc = 0;
        for (int i = 0; i < docCount; i++) {
            doc += in.readVInt();
            docs[i] = doc;
            int freq = in.readVInt();
            freqs[i] = freq;
            starts[i] = positions.size();
            int position = 0;
            for (int p = 0; p < freq; p++) {
                position += in.readVInt();
                positions.add(position);
            }
        }
        starts[docCount] = positions.size();
        return new Postings(docs, freqs, positions.toArray(), starts);
    }

    private static Map<Integer, TermDictionary> readDictionaries(Path path) throws IOException {
        IndexInput in = IndexInput.openVerified(path, TermsWriter.TERMS_FILE_TYPE);
        int fieldCount = in.readVInt();
        Map<Integer, TermDictionary> result = new HashMap<>();
        long offset = 0;
        for (int f = 0; f < fieldCount; f++) {
            int fieldOrdinal = in.readVInt();
            int termCount = in.readVInt();
            int docCount = in.readVInt();
            long sumTotalTermFreq = in.readVLong();
            String[] terms = new String[termCount];
            int[] docFreqs = new int[termCount];
            long[] offsets = new long[termCount];
            int[] lengths = new int[termCount];
            String previous = "";
            for (int t = 0; t < termCount; t++) {
                int shared = in.readVInt();
                if (shared > previous.length()) {
                    throw new CorruptIndexException("Invalid shared prefix length " + shared, path);
                }
                String term = previous.substring(0, shared) + in.readString();
                terms[t] = term;
                docFreqs[t] = in.readVInt();
                offset += in.readVLong();
                offsets[t] = offset;
                lengths[t] = in.readVInt();
                previous = term;
            }
            result.put(fieldOrdinal, new TermDictionary(fieldOrdinal, terms, docFreqs, offsets, lengths,
                docCount, sumTotalTermFreq));
        }
        return result;
    }

    @Override
    public void close() throws IOException {
        postings.close();
    }
}
