package com.rentalrisk.error;

/**
 * A collaborator (fact provider, regulation store) could not answer.
 */
public class DependencyException extends RiskEngineException {

    private final String dependency;

    public DependencyException(String dependency, Throwable cause) {
        super(dependency + " unavailable: " + cause.getMessage(), cause);
        this.dependency = dependency;
    }

    @Override
    public String errorCode() {
        return "DEPENDENCY_UNAVAILABLE";
    }

    public String getDependency() {
        return dependency;
    }
}
