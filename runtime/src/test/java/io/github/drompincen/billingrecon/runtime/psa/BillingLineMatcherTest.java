package io.github.drompincen.billingrecon.runtime.psa;

import io.github.drompincen.billingrecon.protocol.api.MatchMode;
import io.github.drompincen.billingrecon.protocol.api.PsaBillingLine;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BillingLineMatcherTest {

    private final List<PsaBillingLine> lines = List.of(
            line("l1", "Managed Workstation"),
            line("l2", "Server Backup"),
            line("l3", "Backup Storage"),
            line("l4", null));

    @Test
    void substringModeMatchesAnyLineContainingTheName() {
        BillingLineMatcher matcher = new BillingLineMatcher(MatchMode.SUBSTRING);

        assertThat(matcher.matching(lines, "backup"))
                .extracting(PsaBillingLine::externalLineId)
                .containsExactly("l2", "l3");
    }

    @Test
    void exactModeRequiresWholeNameIgnoringCase() {
        BillingLineMatcher matcher = new BillingLineMatcher(MatchMode.EXACT);

        assertThat(matcher.matching(lines, "backup")).isEmpty();
        assertThat(matcher.matching(lines, "server backup"))
                .extracting(PsaBillingLine::externalLineId)
                .containsExactly("l2");
    }

    private static PsaBillingLine line(String id, String productName) {
        return new PsaBillingLine("a1", "ext-a1", id, "Managed Services", productName, 1,
                new BigDecimal("10.00"), BigDecimal.ONE, true, false);
    }
}
