package com.agrichain.offchain.app;

import com.agrichain.offchain.domain.error.ValidationException;
import com.agrichain.offchain.domain.hash.CommitRevealCodec;
import com.agrichain.offchain.domain.model.CommitRevealPair;
import com.agrichain.offchain.domain.model.Digest;
import com.agrichain.offchain.domain.model.DigestFamily;
import com.agrichain.offchain.domain.model.stage.AiScoreRequest;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.Set;


/**
 * Checks a revealed AI score against a previously issued commitment.
 * Malformed hashes are a validation error; a well-formed commitment that does
 * not match is simply reported as invalid.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScoreVerificationService {

    private final CommitRevealCodec commitReveal;
    private final Validator validator;

    public boolean verify(String nonce, String revealHash, String commitHash, AiScoreRequest scoreData) {
        Set<String> errors = new LinkedHashSet<>();
        if (nonce == null || nonce.isBlank()) {
            errors.add("nonce: must not be blank");
        }
        Digest reveal = parse("reveal_hash", revealHash, errors);
        Digest commit = parse("commit_hash", commitHash, errors);
        if (scoreData == null) {
            errors.add("score_data: must not be null");
        } else {
            for (ConstraintViolation<AiScoreRequest> v : validator.validate(scoreData)) {
                errors.add("score_data." + WirePaths.message(v));
            }
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }

        boolean valid = commitReveal.verify(new CommitRevealPair(nonce, reveal, commit), scoreData);
        log.info("Commit-reveal check for batch {}: {}", scoreData.batchId(), valid ? "match" : "mismatch");
        return valid;
    }

    private static Digest parse(String field, String value, Set<String> errors) {
        if (value == null || value.isBlank()) {
            errors.add(field + ": must not be blank");
            return null;
        }
        try {
            return Digest.parse(DigestFamily.GENERAL_PURPOSE, value);
        } catch (IllegalArgumentException e) {
            errors.add(field + ": must be a 32-byte hex digest");
            return null;
        }
    }
}
