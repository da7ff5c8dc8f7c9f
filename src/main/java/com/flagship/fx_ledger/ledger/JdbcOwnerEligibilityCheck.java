package com.flagship.fx_ledger.ledger;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Eligibility backed by the {@code wallet_owners} table: an owner is eligible
 * once their email address has been verified. Unknown owners are not eligible.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JdbcOwnerEligibilityCheck implements OwnerEligibilityCheck {

    private static final String VERIFIED_SQL = "SELECT email_verified FROM wallet_owners WHERE owner_id = ?";
    private static final String EXISTS_SQL = "SELECT COUNT(*) FROM wallet_owners WHERE owner_id = ?";

    private final JdbcTemplate jdbcTemplate;

    @Override
    public boolean isEligible(String ownerId) {
        List<Boolean> verified = jdbcTemplate.queryForList(VERIFIED_SQL, Boolean.class, ownerId);
        if (verified.isEmpty()) {
            log.debug("Owner {} is not registered", ownerId);
            return false;
        }
        return Boolean.TRUE.equals(verified.get(0));
    }

    @Override
    public boolean isRegistered(String ownerId) {
        Integer count = jdbcTemplate.queryForObject(EXISTS_SQL, Integer.class, ownerId);
        return count != null && count > 0;
    }
}
