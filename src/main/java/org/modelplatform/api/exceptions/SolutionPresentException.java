package org.modelplatform.api.exceptions;

/**
 * Thrown when a scenario holding a model solution is checked out for model edits.
 * The caller has to remove the solution or clone the scenario without it first.
 */
public class SolutionPresentException extends PreconditionException {

    public SolutionPresentException(String message) {
        super(message);
    }
}
