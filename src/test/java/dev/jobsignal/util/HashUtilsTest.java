package dev.jobsignal.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HashUtilsTest {

    @Test
    void sha256MatchesKnownDigest() {
        assertThat(HashUtils.sha256Hex("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    void contentHashIgnoresCaseAndSurroundingWhitespace() {
        assertThat(HashUtils.jobContentHash(" Data Engineer", "REMOTE", null))
                .isEqualTo(HashUtils.jobContentHash("data engineer", "remote ", ""));
    }

    @Test
    void contentHashDistinguishesLocation() {
        assertThat(HashUtils.jobContentHash("Data Engineer", "Remote", null))
                .isNotEqualTo(HashUtils.jobContentHash("Data Engineer", "New York", null));
    }

    @Test
    void contentHashKeepsFieldBoundaries() {
        assertThat(HashUtils.jobContentHash("a", "b", null))
                .isNotEqualTo(HashUtils.jobContentHash("a", null, "b"));
    }
}
