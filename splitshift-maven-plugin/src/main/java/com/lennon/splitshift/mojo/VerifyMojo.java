package com.lennon.splitshift.mojo;

import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.MojoFailureException;
import org.apache.maven.plugins.annotations.Mojo;

/**
 * Encrypts {@code -Dtext}, decrypts it with the produced metadata and fails
 * the build unless the original comes back.
 */
@Mojo(name = "verify", requiresProject = false)
public class VerifyMojo extends BaseMojo {

    @Override
    public void execute() throws MojoExecutionException, MojoFailureException {
        initService();

        if (!hasText("verify")){
            return;
        }
        boolean ok = service.verify(text, keys);
        getLog().info("Verification: " + (ok ? "SUCCESS" : "FAILURE"));
        if (!ok) {
            throw new MojoFailureException("Round trip failed for keys " + keys);
        }
    }
}
