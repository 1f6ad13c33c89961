package io.github.drompincen.billingrecon.runtime.psa;

import io.github.drompincen.billingrecon.protocol.api.MatchMode;
import io.github.drompincen.billingrecon.protocol.api.PsaBillingLine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Selects the billing lines a mapped PSA product name refers to. In {@code SUBSTRING} mode
 * "Backup" also matches "Server Backup" and "Backup Storage"; {@code EXACT} requires the
 * whole product name to match. Case is ignored in both.
 */
@Component
public class BillingLineMatcher {

    private final MatchMode mode;

    public BillingLineMatcher(@Value("${billing.reconcile.match-mode:SUBSTRING}") MatchMode mode) {
        this.mode = mode;
    }

    public MatchMode mode() {
        return mode;
    }

    public List<PsaBillingLine> matching(List<PsaBillingLine> lines, String psaProductName) {
        String wanted = psaProductName.toLowerCase(Locale.ROOT);
        return lines.stream()
                .filter(l -> l.productName() != null)
                .filter(l -> matches(l.productName().toLowerCase(Locale.ROOT), wanted))
                .collect(Collectors.toList());
    }

    private boolean matches(String lineName, String wanted) {
        return mode == MatchMode.EXACT ? lineName.equals(wanted) : lineName.contains(wanted);
    }
}
