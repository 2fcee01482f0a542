package com.jsearch.segment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Descriptor of one segment as recorded in the manifest: its directory name,
 * how many documents it physically holds, and which tombstone generation
 * applies to it.
 */
public final class SegmentInfo {
    private final String name;
    private final int maxDoc;
    private final long delGen;
    private final int delCount;

    @JsonCreator
    public SegmentInfo(@JsonProperty("name") String name,
                       @JsonProperty("max_doc") int maxDoc,
                       @JsonProperty("del_gen") long delGen,
                       @JsonProperty("del_count") int delCount) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.maxDoc = maxDoc;
        this.delGen = delGen;
        this.delCount = delCount;
    }

    public static SegmentInfo newSegment(String name, int maxDoc) {
        return new SegmentInfo(name, maxDoc, 0, 0);
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("max_doc")
    public int getMaxDoc() {
        return maxDoc;
    }

    /**
     * Tombstone generation in effect; 0 means the segment has no tombstones.
     */
    @JsonProperty("del_gen")
    public long getDelGen() {
        return delGen;
    }

    @JsonProperty("del_count")
    public int getDelCount() {
        return delCount;
    }

    @JsonIgnore
    public int getLiveDocs() {
        return maxDoc - delCount;
    }

    public boolean hasDeletions() {
        return delGen > 0;
    }

    public SegmentInfo withDeletes(long newDelGen, int newDelCount) {
        return new SegmentInfo(name, maxDoc, newDelGen, newDelCount);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SegmentInfo that = (SegmentInfo) o;
        return maxDoc == that.maxDoc && delGen == that.delGen && delCount == that.delCount
            && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, maxDoc, delGen, delCount);
    }

    @Override
    public String toString() {
        return name + "(maxDoc=" + maxDoc + ", delGen=" + delGen + ", delCount=" + delCount + ")";
    }
}
