package com.lennon.splitshift.mojo;

import com.lennon.splitshift.core.ShiftKeys;
import com.lennon.splitshift.core.SplitShiftService;

import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugins.annotations.Parameter;

public abstract class BaseMojo extends AbstractMojo {

    static final String KEYS_ENV = "SPLITSHIFT_KEYS";

    @Parameter(property = "shift1")
    protected Integer shift1;

    @Parameter(property = "shift2")
    protected Integer shift2;

    @Parameter(property = "text")
    protected String text;

    @Parameter(property = "metadata")
    protected String metadata; // e.g. "ulllL00ULLll0"

    @Parameter(property = "envelope", defaultValue = "false")
    protected boolean envelope; // text is / should be a sealed token

    protected SplitShiftService service;
    protected ShiftKeys keys;

    protected void initService() throws MojoExecutionException {
        try {
            keys = resolveKeys();
        } catch (IllegalArgumentException e) {
            throw new MojoExecutionException(e.getMessage(), e);
        }
        service = new SplitShiftService();
    }

    private ShiftKeys resolveKeys() {
        if (shift1 != null || shift2 != null) {
            if (shift1 == null || shift2 == null) {
                throw new IllegalArgumentException("Both -Dshift1 and -Dshift2 are required");
            }
            return ShiftKeys.of(shift1, shift2);
        }
        // 尝试环境变量
        String env = System.getenv(KEYS_ENV);
        if (env == null || env.isEmpty()){
            throw new IllegalArgumentException("Missing -Dshift1/-Dshift2 (or env " + KEYS_ENV + "=s1,s2)");
        }
        return ShiftKeys.parse(env);
    }

    protected boolean hasText(String action) {
        if (text == null || text.isEmpty()){
            getLog().info("No -Dtext provided, nothing to " + action + ".");
            return false;
        }
        return true;
    }
}
