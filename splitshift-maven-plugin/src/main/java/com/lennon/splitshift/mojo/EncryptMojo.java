package com.lennon.splitshift.mojo;

import com.lennon.splitshift.core.TaggedText;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugins.annotations.Mojo;

@Mojo(name = "encrypt", requiresProject = false)
public class EncryptMojo extends BaseMojo {

    /** Last result, kept for callers that drive the mojo directly. */
    String output;

    @Override
    public void execute() throws MojoExecutionException {
        initService();

        if (!hasText("encrypt")){
            return;
        }
        if (envelope) {
            output = service.seal(text, keys).toToken();
            getLog().info("Envelope: " + output);
            System.out.println(output);
            return;
        }
        TaggedText tagged = service.encodeWithMetadata(text, keys);
        output = tagged.text();
        getLog().info("Encrypted: " + tagged.text());
        getLog().info("Metadata:  " + tagged.metadata());
        System.out.println(tagged.text());
        System.out.println(tagged.metadata());
    }
}
