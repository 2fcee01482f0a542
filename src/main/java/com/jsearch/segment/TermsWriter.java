package com.jsearch.segment;

import com.jsearch.common.IndexConstants;
import com.jsearch.common.io.IndexOutput;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes the term dictionary ({@code terms.dat}) and the postings
 * ({@code postings.dat}) of a segment.
 *
 * Fields are written one after another in ascending ordinal order, and the
 * terms of a field in ascending order. Postings per term: doc count, then per
 * doc the doc delta, the frequency and the position deltas. Dictionary
 * entries share a prefix with the previous term of the field and record the
 * postings offset as a delta to the previous term's offset in the file.
 */
public class TermsWriter implements Closeable {
    static final String TERMS_FILE_TYPE = "terms";
    static final String POSTINGS_FILE_TYPE = "postings";

    private final IndexOutput terms;
    private final IndexOutput postings;
    private final int fieldCount;
    private int fieldsWritten;

    private int currentField = -1;
    private String previousTerm;
    private long previousOffset;
    private int termCount;

    private final List<FieldSummary> summaries = new ArrayList<>();

    /**
     * @param fieldCount number of fields that will be written
     */
    public TermsWriter(Path directory, int fieldCount) throws IOException {
        this.fieldCount = fieldCount;
        this.terms = IndexOutput.create(directory.resolve(IndexConstants.TERMS_FILE));
        this.postings = IndexOutput.create(directory.resolve(IndexConstants.POSTINGS_FILE));
        terms.writeHeader(TERMS_FILE_TYPE);
        postings.writeHeader(POSTINGS_FILE_TYPE);
        terms.writeVInt(fieldCount);
    }

    public void startField(int fieldOrdinal) {
        if (currentField >= 0) {
            throw new IllegalStateException("Field " + currentField + " not finished");
        }
        currentField = fieldOrdinal;
        previousTerm = "";
        termCount = 0;
        summaries.add(new FieldSummary(fieldOrdinal));
    }

    /**
     * Appends the postings of the next term of the current field.
     */
    public void addTerm(String term, Postings termPostings) throws IOException {
        if (currentField < 0) {
            throw new IllegalStateException("No field started");
        }
        if (termCount > 0 && term.compareTo(previousTerm) <= 0) {
            throw new IllegalArgumentException("Terms out of order: '" + term + "' after '" + previousTerm + "'");
        }
        long start = postings.getFilePointer();
        int docCount = termPostings.size();
        postings.writeVInt(docCount);
        int previousDoc = 0;
        for (int i = 0; i < docCount; i++) {
            int doc = termPostings.doc(i);
            postings.writeVInt(doc - previousDoc);
            previousDoc = doc;
            int[] positions = termPostings.positions(i);
            postings.writeVInt(positions.length);
            int previousPosition = 0;
            for (int position : positions) {
                postings.writeVInt(position - previousPosition);
                previousPosition = position;
            }
        }
        int length = (int) (postings.getFilePointer() - start);

        FieldSummary summary = summaries.get(summaries.size() - 1);
        summary.entries.add(new TermEntry(term, previousTerm, docCount, start - previousOffset, length));
        summary.sumTotalTermFreq += termPostings.totalTermFreq();

        previousTerm = term;
        previousOffset = start;
        termCount++;
    }

    /**
     * Closes the current field.
     *
     * @param docCount number of documents that have the field
     */
    public void finishField(int docCount) {
        if (currentField < 0) {
            throw new IllegalStateException("No field started");
        }
        summaries.get(summaries.size() - 1).docCount = docCount;
        currentField = -1;
        fieldsWritten++;
    }

    /**
     * Writes the dictionary, footers and forces both files to disk.
     */
    public void finish() throws IOException {
        if (fieldsWritten != fieldCount) {
            throw new IllegalStateException("Expected " + fieldCount + " fields but got " + fieldsWritten);
        }
        for (FieldSummary summary : summaries) {
            terms.writeVInt(summary.fieldOrdinal);
            terms.writeVInt(summary.entries.size());
            terms.writeVInt(summary.docCount);
            terms.writeVLong(summary.sumTotalTermFreq);
            for (TermEntry entry : summary.entries) {
                int shared = sharedPrefix(entry.previous, entry.term);
                terms.writeVInt(shared);
                terms.writeString(entry.term.substring(shared));
                terms.writeVInt(entry.docFreq);
                terms.writeVLong(entry.offsetDelta);
                terms.writeVInt(entry.length);
            }
        }
        terms.writeFooter();
        postings.writeFooter();
        terms.sync();
        postings.sync();
    }

    @Override
    public void close() throws IOException {
        try {
            terms.close();
        } finally {
            postings.close();
        }
    }

    /**
     * Length of the common prefix, never splitting a surrogate pair.
     */
    static int sharedPrefix(String a, String b) {
        int max = Math.min(a.length(), b.length());
        int shared = 0;
        while (shared < max && a.charAt(shared) == b.charAt(shared)) {
            shared++;
        }
        if (shared > 0 && Character.isHighSurrogate(a.charAt(shared - 1))) {
            shared--;
        }
        return shared;
    }

    private static final class FieldSummary {
        private final int fieldOrdinal;
        private final List<TermEntry> entries = new ArrayList<>();
        private int docCount;
        private long sumTotalTermFreq;

        private FieldSummary(int fieldOrdinal) {
            this.fieldOrdinal = fieldOrdinal;
        }
    }

    private static final class TermEntry {
        private final String term;
        private final String previous;
        private final int docFreq;
        private final long offsetDelta;
        private final int length;

        private TermEntry(String term, String previous, int docFreq, long offsetDelta, int length) {
            this.term = term;
            this.previous = previous;
            this.docFreq = docFreq;
            this.offsetDelta = offsetDelta;
            this.length = length;
        }
    }
}
