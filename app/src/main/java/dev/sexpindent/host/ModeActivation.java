package dev.sexpindent.host;

import dev.sexpindent.highlight.HighlightRule;
import dev.sexpindent.indent.IndentationProvider;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Enables or disables the indentation engine and the symbol highlighting on a host. The two
 * installations are held as separate registrations and can be withdrawn one at a time.
 */
public class ModeActivation {

    private static final Logger LOGGER = LoggerFactory.getLogger(ModeActivation.class);

    private final LanguageModeHost host;
    private final IndentationProvider provider;
    private final HighlightRule highlightRule;

    private Registration indentation;
    private Registration highlighting;

    public ModeActivation(LanguageModeHost host, IndentationProvider provider, HighlightRule highlightRule) {
        this.host = Objects.requireNonNull(host, "host");
        this.provider = Objects.requireNonNull(provider, "provider");
        this.highlightRule = Objects.requireNonNull(highlightRule, "highlightRule");
    }

    public void setEnabled(boolean enabled) {
        if (enabled) {
            enable();
        } else {
            revokeIndentation();
            revokeHighlighting();
            LOGGER.info("Indentation mode disabled");
        }
    }

    /**
     * True while either installation is still live.
     */
    public boolean isEnabled() {
        return isLive(indentation) || isLive(highlighting);
    }

    public boolean isIndentationActive() {
        return isLive(indentation);
    }

    public boolean isHighlightingActive() {
        return isLive(highlighting);
    }

    public void revokeIndentation() {
        if (indentation != null) {
            indentation.close();
            indentation = null;
        }
    }

    public void revokeHighlighting() {
        if (highlighting != null) {
            highlighting.close();
            highlighting = null;
        }
    }

    private void enable() {
        if (!isLive(indentation)) {
            indentation = host.installIndentationProvider(provider);
        }
        if (!isLive(highlighting)) {
            highlighting = host.addHighlightRule(highlightRule);
        }
        LOGGER.info("Indentation mode enabled");
    }

    private static boolean isLive(Registration registration) {
        return registration != null && registration.isActive();
    }
}
