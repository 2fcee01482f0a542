package com.jsearch.index;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.jsearch.common.IndexConstants;
import com.jsearch.segment.SegmentInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The published state of an index: the ordered segment set and its
 * counters. Written to {@code manifest.json} on every publication.
 */
public final class Manifest {
    private final int formatVersion;
    private final long commitSequence;
    private final long generation;
    private final long nextSegmentId;
    private final List<SegmentInfo> segments;

    @JsonCreator
    public Manifest(@JsonProperty("format_version") int formatVersion,
                    @JsonProperty("commit_seq") long commitSequence,
                    @JsonProperty("generation") long generation,
                    @JsonProperty("next_segment_id") long nextSegmentId,
                    @JsonProperty("segments") List<SegmentInfo> segments) {
        this.formatVersion = formatVersion;
        this.commitSequence = commitSequence;
        this.generation = generation;
        this.nextSegmentId = nextSegmentId;
        this.segments = segments == null
            ? Collections.emptyList()
            : Collections.unmodifiableList(new ArrayList<>(segments));
    }

    public static Manifest empty() {
        return new Manifest(IndexConstants.FORMAT_VERSION, 0, 0, 1, Collections.emptyList());
    }

    @JsonProperty("format_version")
    public int getFormatVersion() {
        return formatVersion;
    }

    /**
     * Bumped by every commit that changed something.
     */
    @JsonProperty("commit_seq")
    public long getCommitSequence() {
        return commitSequence;
    }

    /**
     * Bumped by every publication, commits and merges alike.
     */
    @JsonProperty("generation")
    public long getGeneration() {
        return generation;
    }

    @JsonProperty("next_segment_id")
    public long getNextSegmentId() {
        return nextSegmentId;
    }

    @JsonProperty("segments")
    public List<SegmentInfo> getSegments() {
        return segments;
    }

    @JsonIgnore
    public long getNumDocs() {
        long total = 0;
        for (SegmentInfo segment : segments) {
            total += segment.getLiveDocs();
        }
        return total;
    }

    public Manifest nextCommit(List<SegmentInfo> newSegments, long newNextSegmentId) {
        return new Manifest(formatVersion, commitSequence + 1, generation + 1, newNextSegmentId, newSegments);
    }

    public Manifest nextMerge(List<SegmentInfo> newSegments, long newNextSegmentId) {
        return new Manifest(formatVersion, commitSequence, generation + 1, newNextSegmentId, newSegments);
    }

    @Override
    public String toString() {
        return "Manifest(commitSeq=" + commitSequence + ", generation=" + generation + ", segments=" + segments + ")";
    }
}
