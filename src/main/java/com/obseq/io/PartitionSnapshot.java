package com.obseq.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.obseq.api.Cut;
import com.obseq.api.Interval;
import com.obseq.engine.PartitionEngine;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;

/**
 * POJO capture of a solved partition, for export and offline inspection.
 *
 * <p>
 * The snapshot holds only element handles and window statistics; it cannot be
 * loaded back into an engine, which never owns the sequence.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class PartitionSnapshot {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private long epoch;
    private int headSize, tailSize;
    private CutDef bestCut;
    private List<GroupDef> groups = new ArrayList<>();

    /** The certified cut. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class CutDef {
        private int element;
        private String side;
    }

    /** One group, bounds inclusive. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class GroupDef {
        private int first, last;
    }

    /**
     * Captures the current partition of {@code engine}, solving first if it is
     * stale.
     *
     * @throws IllegalStateException if the engine was never solved.
     */
    public static PartitionSnapshot capture(PartitionEngine<?, ?> engine) {
        List<Interval> intervals = engine.groups();

        PartitionSnapshot snapshot = new PartitionSnapshot();
        snapshot.setEpoch(engine.epoch());
        snapshot.setHeadSize(engine.headSize());
        snapshot.setTailSize(engine.tailSize());

        Cut cut = engine.bestCut();
        if (cut != null) {
            CutDef def = new CutDef();
            def.setElement(cut.element());
            def.setSide(cut.side().name());
            snapshot.setBestCut(def);
        }
        for (Interval interval : intervals) {
            GroupDef g = new GroupDef();
            g.setFirst(interval.first());
            g.setLast(interval.last());
            snapshot.getGroups().add(g);
        }
        return snapshot;
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize partition snapshot at epoch " + epoch, e);
        }
    }

    public static PartitionSnapshot fromJson(String json) {
        try {
            return MAPPER.readValue(json, PartitionSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed partition snapshot", e);
        }
    }
}
