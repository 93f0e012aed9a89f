package com.lennon.splitshift.mojo;

import com.lennon.splitshift.core.CipherEnvelope;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.MojoFailureException;
import org.apache.maven.plugins.annotations.Mojo;

@Mojo(name = "decrypt", requiresProject = false)
public class DecryptMojo extends BaseMojo {

    String output;

    @Override
    public void execute() throws MojoExecutionException, MojoFailureException {
        initService();

        if (!hasText("decrypt")){
            return;
        }
        try {
            if (envelope) {
                CipherEnvelope env = CipherEnvelope.parse(text);
                output = service.open(env, keys);
                if (!env.matches(output)) {
                    throw new MojoFailureException("Decrypted text does not match envelope digest (wrong keys?)");
                }
            } else if (metadata != null) {
                output = service.decodeWithMetadata(text, metadata, keys);
            } else {
                getLog().warn("No -Dmetadata given, guessing; the result may differ from the original text.");
                output = service.decodeHeuristic(text, keys);
            }
        } catch (IllegalArgumentException e) {
            throw new MojoExecutionException(e.getMessage(), e);
        }
        getLog().info("Decrypted: " + output);
        System.out.println(output);
    }
}
