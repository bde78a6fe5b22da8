package org.celtext.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Positional metadata recorded by the parser.
 *
 * <p>{@code positions} maps node ids to character offsets in the original source.
 * {@code lineOffsets} holds, for every line of the source, the offset just past its terminating
 * line break; the break itself therefore sits at {@code offset - 1} and the last entry is the
 * end-of-source sentinel {@code length + 1}. Single-line sources have exactly one entry.
 */
public record SourceInfo(Map<Long, Integer> positions, List<Integer> lineOffsets) {

    public static final SourceInfo EMPTY = new SourceInfo(Map.of(), List.of());

    public SourceInfo {
        positions = Map.copyOf(positions);
        lineOffsets = List.copyOf(lineOffsets);
        for (var offset : positions.values()) {
            checkArgument(offset >= 0, "Negative source offset: %s", offset);
        }
        for (var offset : lineOffsets) {
            checkArgument(offset >= 0, "Negative line offset: %s", offset);
        }
    }

    public static SourceInfo of(Map<Long, Integer> positions, List<Integer> lineOffsets) {
        return new SourceInfo(positions, lineOffsets);
    }

    /**
     * Build source info for the given source text, deriving line offsets from its line breaks.
     */
    public static SourceInfo forSource(String source, Map<Long, Integer> positions) {
        var offsets = new ArrayList<Integer>();
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                offsets.add(i + 1);
            }
        }
        offsets.add(source.length() + 1);
        return new SourceInfo(positions, offsets);
    }

    /**
     * Source offset of the node with the given id, or 0 when the id was not recorded.
     */
    public int position(long id) {
        return positions.getOrDefault(id, 0);
    }

    public boolean isMultiline() {
        return lineOffsets.size() > 1;
    }
}
