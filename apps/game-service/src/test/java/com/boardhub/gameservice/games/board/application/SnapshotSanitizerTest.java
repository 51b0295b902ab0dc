package com.boardhub.gameservice.games.board.application;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class SnapshotSanitizerTest {

    private final Set<String> known = Set.of("a", "b");
    private final List<String> warnings = new ArrayList<>();

    @Test
    void idListDropsUnknownBlankAndDuplicateIds() {
        List<String> ids = SnapshotSanitizer.idList(Arrays.asList("a", " b ", "a", "", null, "zed"), known, "forfeited", warnings);

        assertThat(ids).containsExactly("a", "b");
        assertThat(warnings).hasSize(4);
    }

    @Test
    void intMapCoercesNumericStringsAndDropsTheRest() {
        Map<Object, Object> raw = new LinkedHashMap<>();
        raw.put("a", "12");
        raw.put("b", "twelve");
        raw.put("zed", 4);

        Map<String, Integer> out = SnapshotSanitizer.intMap(raw, known, "tiles", warnings);

        assertThat(out).containsExactly(Map.entry("a", 12));
        assertThat(warnings).containsExactly(
                "tiles: unknown participant zed removed",
                "tiles: non-numeric value for b discarded");
    }

    @Test
    void wrongShapesAreDiscarded() {
        assertThat(SnapshotSanitizer.idList(Map.of(), known, "turnOrder", warnings)).isEmpty();
        assertThat(SnapshotSanitizer.intMap(List.of(1), known, "tiles", warnings)).isEmpty();
        assertThat(warnings).containsExactly("turnOrder: expected a list, discarded", "tiles: expected a map, discarded");
    }

    @Test
    void toIntAcceptsWholeNumbersOnly() {
        assertThat(SnapshotSanitizer.toInt(7L)).hasValue(7);
        assertThat(SnapshotSanitizer.toInt(7.0)).hasValue(7);
        assertThat(SnapshotSanitizer.toInt("8.0")).hasValue(8);
        assertThat(SnapshotSanitizer.toInt(7.5)).isEmpty();
        assertThat(SnapshotSanitizer.toInt(true)).isEmpty();
    }

    @Test
    void boolReadsStringsAndDefaultsToFalse() {
        assertThat(SnapshotSanitizer.bool("TRUE")).isTrue();
        assertThat(SnapshotSanitizer.bool(1)).isFalse();
        assertThat(SnapshotSanitizer.bool(null)).isFalse();
    }
}
