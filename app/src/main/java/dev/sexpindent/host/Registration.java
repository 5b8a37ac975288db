package dev.sexpindent.host;

/**
 * Handle for something installed into a {@link LanguageModeHost}. Closing it withdraws the
 * installation; closing twice has no further effect.
 */
public interface Registration extends AutoCloseable {

    boolean isActive();

    @Override
    void close();
}
