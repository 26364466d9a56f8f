package eu.fbk.pgstore.internal;

import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class Util {

    private static final Logger LOGGER = LoggerFactory.getLogger(Util.class);

    @Nullable
    public static <T> T closeQuietly(@Nullable final T object) {
        if (object instanceof AutoCloseable) {
            try {
                ((AutoCloseable) object).close();
            } catch (final Throwable ex) {
                LOGGER.error("Error closing " + object.getClass().getSimpleName(), ex);
            }
        }
        return object;
    }

    private Util() {
    }

}
