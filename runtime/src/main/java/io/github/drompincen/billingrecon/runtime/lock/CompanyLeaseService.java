package io.github.drompincen.billingrecon.runtime.lock;

import io.github.drompincen.billingrecon.persistence.document.LeaseDocument;
import io.github.drompincen.billingrecon.persistence.repository.LeaseRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Time-bounded exclusive claim on a company's reconciliation rows. The unique index on
 * {@code companyId} means two racing acquirers cannot both insert; an expired lease is
 * replaced by the next acquirer.
 */
@Service
public class CompanyLeaseService {

    private static final Logger log = LoggerFactory.getLogger(CompanyLeaseService.class);

    private final LeaseRepository leaseRepository;
    private final Duration ttl;

    public CompanyLeaseService(LeaseRepository leaseRepository,
                               @Value("${billing.lease.ttl-seconds:600}") long ttlSeconds) {
        this.leaseRepository = leaseRepository;
        this.ttl = Duration.ofSeconds(ttlSeconds);
    }

    public Optional<String> tryAcquire(String companyId, String purpose) {
        return tryAcquire(companyId, purpose, ttl);
    }

    public Optional<String> tryAcquire(String companyId, String purpose, Duration leaseTtl) {
        var existing = leaseRepository.findByCompanyId(companyId);
        if (existing.isPresent() && existing.get().getExpiresAt().isAfter(Instant.now())) {
            return Optional.empty();
        }
        existing.ifPresent(expired -> {
            log.info("Replacing expired {} lease on company {} held by {}",
                    expired.getPurpose(), companyId, expired.getOwner());
            leaseRepository.delete(expired);
        });

        String owner = UUID.randomUUID().toString();
        LeaseDocument lease = new LeaseDocument();
        lease.setLeaseId(UUID.randomUUID().toString());
        lease.setCompanyId(companyId);
        lease.setOwner(owner);
        lease.setPurpose(purpose);
        lease.setAcquiredAt(Instant.now());
        lease.setExpiresAt(Instant.now().plus(leaseTtl));
        try {
            leaseRepository.insert(lease);
        } catch (DuplicateKeyException e) {
            log.debug("Lost lease race on company {}", companyId);
            return Optional.empty();
        }
        return Optional.of(owner);
    }

    public void release(String companyId, String owner) {
        leaseRepository.findByCompanyId(companyId)
                .filter(l -> l.getOwner().equals(owner))
                .ifPresent(leaseRepository::delete);
    }

    public boolean isLeased(String companyId) {
        return leaseRepository.findByCompanyId(companyId)
                .filter(l -> l.getExpiresAt().isAfter(Instant.now()))
                .isPresent();
    }

    /**
     * Runs {@code work} while holding the company's lease, releasing it on every exit path.
     *
     * @throws CompanyBusyException if the lease is held by someone else
     */
    public <T> T withLease(String companyId, String purpose, Supplier<T> work) {
        String owner = tryAcquire(companyId, purpose).orElseThrow(() -> new CompanyBusyException(companyId));
        try {
            return work.get();
        } finally {
            release(companyId, owner);
        }
    }
}
