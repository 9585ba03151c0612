package com.hrx.core.model;

import com.hrx.core.error.HrxContentException;
import com.hrx.core.validation.ContentViolation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link HrxArchive}.
 */
class HrxArchiveTest {

    private static final String MIXED_BOUNDARIES = """
        <===> boundary-5.txt
        This file contains a 5-length boundary:
        <=====>
        ^ right there

        <===>
        This is a comment,
        <=======>
        which contains a 7-length boundary.

        <===> fine.txt
        This file consists of
        multiple lines, but none of them
        starts with any sort of boundary-like string""";

    private HrxArchive archive;

    @BeforeEach
    void setUp() {
        archive = HrxArchive.parse(MIXED_BOUNDARIES);
    }

    @Test
    void parse_discoversBoundaryLength() {
        assertThat(archive.boundaryLength()).isEqualTo(3);
        assertThat(archive.entries()).hasSize(2);
    }

    @Test
    void parse_lastBodyWithoutNewline_keepsBodyAndTextForm() {
        assertThat(archive.entry("fine.txt").get().body())
            .endsWith("starts with any sort of boundary-like string");
        assertThat(archive.hasTrailingNewline()).isFalse();
        assertThat(archive.serializeToString()).isEqualTo(MIXED_BOUNDARIES);
    }

    @Test
    void setBoundaryLength_safeLength_updatesLength() {
        archive.setBoundaryLength(4);
        assertThat(archive.boundaryLength()).isEqualTo(4);

        archive.setBoundaryLength(6);
        assertThat(archive.boundaryLength()).isEqualTo(6);

        archive.setBoundaryLength(8);
        assertThat(archive.boundaryLength()).isEqualTo(8);
    }

    @Test
    void setBoundaryLength_lengthFoundInBody_failsAndKeepsLength() {
        archive.setBoundaryLength(4);
        String before = archive.serializeToString();

        assertThatThrownBy(() -> archive.setBoundaryLength(5))
            .isInstanceOf(HrxContentException.class)
            .extracting(e -> ((HrxContentException) e).getViolation())
            .isEqualTo(new ContentViolation.EntryData(HrxPath.parse("boundary-5.txt")));

        assertThat(archive.boundaryLength()).isEqualTo(4);
        assertThat(archive.serializeToString()).isEqualTo(before);
    }

    @Test
    void setBoundaryLength_lengthFoundInComment_failsWithEntryComment() {
        archive.setBoundaryLength(6);

        assertThatThrownBy(() -> archive.setBoundaryLength(7))
            .isInstanceOf(HrxContentException.class)
            .extracting(e -> ((HrxContentException) e).getViolation())
            .isEqualTo(new ContentViolation.EntryComment(HrxPath.parse("fine.txt")));

        assertThat(archive.boundaryLength()).isEqualTo(6);
    }

    @Test
    void setBoundaryLength_zero_throwsIllegalArgument() {
        assertThatThrownBy(() -> archive.setBoundaryLength(0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(archive.boundaryLength()).isEqualTo(3);
    }

    @Test
    void validateContent_afterCommentMutation_reportsRootComment() {
        HrxArchive commentOnly = HrxArchive.parse("<===>\nA HRX file may consist of only a comment and nothing else.\n");
        commentOnly.validateContent();

        commentOnly.setComment(commentOnly.getComment() + "\n<===>\nNow the comment contains the boundary!");

        assertThatThrownBy(commentOnly::validateContent)
            .isInstanceOf(HrxContentException.class)
            .hasMessageContaining("root comment")
            .extracting(e -> ((HrxContentException) e).getViolation())
            .isInstanceOf(ContentViolation.RootComment.class);
    }

    @Test
    void empty_createsArchiveWithoutContent() {
        HrxArchive empty = HrxArchive.empty(5);

        assertThat(empty.boundaryLength()).isEqualTo(5);
        assertThat(empty.getComment()).isNull();
        assertThat(empty.entries()).isEmpty();
    }

    @Test
    void empty_withZeroLength_throwsIllegalArgument() {
        assertThatThrownBy(() -> HrxArchive.empty(0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void entries_preserveInsertionOrder() {
        HrxArchive built = HrxArchive.empty(3);
        built.entries().put(HrxPath.parse("z"), HrxEntry.file("last letter"));
        built.entries().put(HrxPath.parse("a"), HrxEntry.directory());
        built.entries().put(HrxPath.parse("m"), HrxEntry.file(null));

        assertThat(built.entries().keySet())
            .extracting(HrxPath::value)
            .containsExactly("z", "a", "m");
    }

    @Test
    void entry_looksUpByRawPath() {
        assertThat(archive.entry("fine.txt")).isPresent();
        assertThat(archive.entry("fine.txt").get().comment()).startsWith("This is a comment,");
        assertThat(archive.entry("missing")).isEmpty();
    }

    @Test
    void equals_considersEntryOrder() {
        HrxArchive first = HrxArchive.empty(3);
        first.entries().put(HrxPath.parse("a"), HrxEntry.file("1"));
        first.entries().put(HrxPath.parse("b"), HrxEntry.file("2"));

        HrxArchive same = HrxArchive.empty(3);
        same.entries().put(HrxPath.parse("a"), HrxEntry.file("1"));
        same.entries().put(HrxPath.parse("b"), HrxEntry.file("2"));

        HrxArchive reordered = HrxArchive.empty(3);
        reordered.entries().put(HrxPath.parse("b"), HrxEntry.file("2"));
        reordered.entries().put(HrxPath.parse("a"), HrxEntry.file("1"));

        assertThat(first).isEqualTo(same).hasSameHashCodeAs(same);
        assertThat(first).isNotEqualTo(reordered);
    }

    @Test
    void equals_considersBoundaryLength() {
        assertThat(HrxArchive.empty(3)).isNotEqualTo(HrxArchive.empty(4));
    }
}
