package ai.pipestream.websub.callback;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.security.SecureRandom;
import java.util.Random;
import java.util.function.Supplier;

/**
 * Generates random callback path segments for services that do not configure a path.
 * <p>
 * If no random source can be obtained the generator falls back to {@link #FALLBACK_SEGMENT}.
 * Two services falling back on the same listener collide on that path.
 */
@ApplicationScoped
public class PathSegmentGenerator {

    private static final Logger LOG = Logger.getLogger(PathSegmentGenerator.class);

    static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";
    public static final int SEGMENT_LENGTH = 10;
    public static final String FALLBACK_SEGMENT = "websubsubscriber";

    private final Supplier<? extends Random> randomSource;
    private volatile Random random;

    public PathSegmentGenerator() {
        this(SecureRandom::new);
    }

    public PathSegmentGenerator(Supplier<? extends Random> randomSource) {
        this.randomSource = randomSource;
    }

    /**
     * Returns a fresh segment of {@value #SEGMENT_LENGTH} alphanumeric characters, or the
     * fallback segment when randomness is unavailable.
     */
    public String generate() {
        try {
            Random source = random();
            StringBuilder segment = new StringBuilder(SEGMENT_LENGTH);
            for (int i = 0; i < SEGMENT_LENGTH; i++) {
                segment.append(ALPHABET.charAt(source.nextInt(ALPHABET.length())));
            }
            return segment.toString();
        } catch (RuntimeException e) {
            LOG.warnf(e, "Random source unavailable, using fallback callback path segment '%s'", FALLBACK_SEGMENT);
            return FALLBACK_SEGMENT;
        }
    }

    private Random random() {
        Random current = random;
        if (current == null) {
            synchronized (this) {
                current = random;
                if (current == null) {
                    current = randomSource.get();
                    if (current == null) {
                        throw new IllegalStateException("random source returned null");
                    }
                    random = current;
                }
            }
        }
        return current;
    }
}
