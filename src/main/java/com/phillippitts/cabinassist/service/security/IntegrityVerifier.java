package com.phillippitts.cabinassist.service.security;

/**
 * Startup security gate. Started before any other component, stopped after all of them.
 */
public interface IntegrityVerifier {

    void start();

    /**
     * @return true when the installation passed verification
     */
    boolean verifySystemIntegrity();

    void stop();
}
