package com.lennon.splitshift.consumer;

import com.lennon.splitshift.core.CipherEnvelope;
import com.lennon.splitshift.core.ShiftKeys;
import com.lennon.splitshift.core.SplitShiftService;
import com.lennon.splitshift.core.TaggedText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simple consumer demo that shows how to call the split-shift service.
 * Usage: run with -DSPLITSHIFT_KEYS=s1,s2 or set env SPLITSHIFT_KEYS; defaults to 3,2.
 */
public class ConsumerDemo {
    private static final Logger log = LoggerFactory.getLogger(ConsumerDemo.class);

    static final String DEFAULT_KEYS = "3,2";

    static ShiftKeys keysFromEnvironment() {
        String keys = System.getProperty("SPLITSHIFT_KEYS");
        if (keys == null || keys.isEmpty()) keys = System.getenv("SPLITSHIFT_KEYS");
        if (keys == null || keys.isEmpty()) {
            log.info("SPLITSHIFT_KEYS not provided, using {}", DEFAULT_KEYS);
            keys = DEFAULT_KEYS;
        }
        return ShiftKeys.parse(keys);
    }

    public static void main(String[] args) {
        ShiftKeys keys = keysFromEnvironment();
        SplitShiftService service = new SplitShiftService();

        String text = args.length > 0 ? String.join(" ", args) : "Hello, World!";
        TaggedText tagged = service.encodeWithMetadata(text, keys);
        String exact = service.decodeWithMetadata(tagged, keys);
        String guessed = service.decodeHeuristic(tagged.text(), keys);

        log.info("plain: {}, enc: {}, meta: {}", text, tagged.text(), tagged.metadata());
        log.info("decoded with metadata: {}, without: {}", exact, guessed);

        CipherEnvelope env = service.seal(text, keys);
        String opened = service.open(CipherEnvelope.parse(env.toToken()), keys);
        log.info("envelope: {}, verified: {}", env.toToken(), env.matches(opened));
    }
}
