package com.example.cortex.service.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.cortex.config.CortexProperties;
import org.apache.commons.codec.digest.DigestUtils;
import org.junit.jupiter.api.Test;

class RateLimitIdentityResolverTest {

    private final RateLimitIdentityResolver resolver = new RateLimitIdentityResolver(new CortexProperties());

    @Test
    void signedInUsersShareOneIdentity() {
        assertThat(resolver.resolve("u1", "token-a")).isEqualTo("user:u1");
        assertThat(resolver.resolve("u1", null)).isEqualTo("user:u1");
        assertThat(resolver.resolve("u1", null, "10.0.0.7")).isEqualTo("user:u1");
    }

    @Test
    void anonymousCallersAreKeyedByTokenDigest() {
        String identity = resolver.resolve("anonymous", "token-a");

        assertThat(identity).isEqualTo("anon:" + DigestUtils.sha256Hex("token-a"));
        assertThat(identity).doesNotContain("token-a");
        assertThat(resolver.resolve(null, " token-a ")).isEqualTo(identity);
        assertThat(resolver.resolve("anonymous", "token-b")).isNotEqualTo(identity);
    }

    @Test
    void longTokensProduceFixedLengthIdentities() {
        String identity = resolver.resolve("anonymous", "t".repeat(300));

        assertThat(identity).hasSize("anon:".length() + 64);
    }

    @Test
    void longUserIdsAndAddressesAreDigested() {
        String longUserId = "u".repeat(300);

        assertThat(resolver.resolve(longUserId, null)).isEqualTo("user:sha256:" + DigestUtils.sha256Hex(longUserId));
        assertThat(resolver.resolve("u".repeat(128), null)).isEqualTo("user:" + "u".repeat(128));
        assertThat(resolver.resolve(null, null, "a".repeat(200))).startsWith("ip:sha256:");
    }

    @Test
    void clientAddressIsUsedWhenNoTokenIsSent() {
        assertThat(resolver.resolve("anonymous", null, "10.0.0.7")).isEqualTo("ip:10.0.0.7");
    }

    @Test
    void anonymousCallersWithoutTokenNeverShareABucket() {
        String first = resolver.resolve("anonymous", null);
        String second = resolver.resolve("anonymous", "");

        assertThat(first).startsWith("anon:");
        assertThat(second).startsWith("anon:");
        assertThat(first).isNotEqualTo(second);
    }

    @Test
    void blankAndConfiguredIdsAreAnonymous() {
        assertThat(resolver.isAnonymous("anonymous")).isTrue();
        assertThat(resolver.isAnonymous("  ")).isTrue();
        assertThat(resolver.isAnonymous("u1")).isFalse();
    }
}
