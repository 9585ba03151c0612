package com.hrx.core.parser;

import com.hrx.core.error.NoBoundaryException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link BoundaryDiscovery}.
 */
class BoundaryDiscoveryTest {

    @Test
    void discover_markerAtStart_returnsWidth() {
        assertThat(BoundaryDiscovery.discover("<===> x\n")).isEqualTo(3);
        assertThat(BoundaryDiscovery.discover("<=>\n")).isEqualTo(1);
    }

    @Test
    void discover_markerAfterNewline_returnsWidth() {
        assertThat(BoundaryDiscovery.discover("preamble\n<=====> file\n")).isEqualTo(5);
    }

    @Test
    void discover_usesFirstMarkerOnly() {
        assertThat(BoundaryDiscovery.discover("<==> a\n<======> b\n")).isEqualTo(2);
    }

    @Test
    void discover_ignoresMarkersInsideLines() {
        assertThat(BoundaryDiscovery.discover("text <=> inline\n<====>\n")).isEqualTo(4);
    }

    @Test
    void discover_carriageReturnDoesNotStartLine() {
        assertThat(BoundaryDiscovery.discover("a\r<=>\n<===>\n")).isEqualTo(3);
    }

    @ParameterizedTest
    @ValueSource(strings = {"no markers here", "", "<>\n", "< => x", " <===>", "<===\n", "text <===> later"})
    void discover_withoutMarker_throwsNoBoundary(String text) {
        assertThatThrownBy(() -> BoundaryDiscovery.discover(text))
            .isInstanceOf(NoBoundaryException.class);
    }

    @Test
    void discoverLength_wrapsWidth() {
        assertThat(BoundaryDiscovery.discoverLength("<==>\ncomment\n").value()).isEqualTo(2);
    }
}
