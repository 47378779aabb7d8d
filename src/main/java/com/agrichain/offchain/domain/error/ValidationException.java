package com.agrichain.offchain.domain.error;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;


/** Malformed or missing input.  Never retried. */
public class ValidationException extends ProvenanceException {

    private final Set<String> errors;

    public ValidationException(Set<String> errors) {
        super("Validation failed: " + (errors == null ? "[]" : new TreeSet<>(errors)));
        this.errors = errors == null ? Collections.emptySet() : Collections.unmodifiableSet(new TreeSet<>(errors));
    }

    public ValidationException(String error) {
        this(Set.of(error));
    }

    public Set<String> getErrors() {
        return errors;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.VALIDATION;
    }
}
