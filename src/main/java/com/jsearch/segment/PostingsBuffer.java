package com.jsearch.segment;

/**
 * In-memory postings of one term while documents are buffered. Docs arrive
 * in ascending order, at most once each.
 */
class PostingsBuffer {
    private final IntArrayBuffer docs = new IntArrayBuffer(4);
    private final IntArrayBuffer freqs = new IntArrayBuffer(4);
    private final IntArrayBuffer positions = new IntArrayBuffer(4);

    void add(int doc, int[] termPositions) {
        docs.add(doc);
        freqs.add(termPositions.length);
        positions.addAll(termPositions);
    }

    int docCount() {
        return docs.size();
    }

    int doc(int index) {
        return docs.get(index);
    }

    /**
     * Copies the postings, dropping deleted docs and renumbering the rest
     * through {@code docMap} (-1 marks a dropped doc).
     *
     * @return The remapped postings, or null if no doc survives
     */
    Postings toPostings(int[] docMap) {
        IntArrayBuffer keptDocs = new IntArrayBuffer(docs.size());
        IntArrayBuffer keptFreqs = new IntArrayBuffer(docs.size());
        IntArrayBuffer keptPositions = new IntArrayBuffer(positions.size());
        IntArrayBuffer starts = new IntArrayBuffer(docs.size() + 1);
        int positionOffset = 0;
        for (int i = 0; i < docs.size(); i++) {
            int freq = freqs.get(i);
            int newDoc = docMap[docs.get(i)];
            if (newDoc >= 0) {
                starts.add(keptPositions.size());
                keptDocs.add(newDoc);
                keptFreqs.add(freq);
                for (int p = 0; p < freq; p++) {
                    keptPositions.add(positions.get(positionOffset + p));
                }
            }
            positionOffset += freq;
        }
        if (keptDocs.size() == 0) {
            return null;
        }
        starts.add(keptPositions.size());
        return new Postings(keptDocs.toArray(), keptFreqs.toArray(), keptPositions.toArray(), starts.toArray());
    }
}
