package dev.sexpindent.host;

import dev.sexpindent.highlight.HighlightRule;
import dev.sexpindent.highlight.HighlightSpan;
import dev.sexpindent.indent.IndentationProvider;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Minimal editing environment: holds the active indentation provider and the highlight rules.
 * Providers are installed on a stack; the most recent live one is active, falling back to the
 * default provider when none is installed.
 */
public class LanguageModeHost {

    private static final Logger LOGGER = LoggerFactory.getLogger(LanguageModeHost.class);

    private final IndentationProvider defaultProvider;
    private final Deque<ProviderRegistration> providers = new ArrayDeque<>();
    private final List<RuleRegistration> highlightRules = new ArrayList<>();

    public LanguageModeHost(IndentationProvider defaultProvider) {
        this.defaultProvider = Objects.requireNonNull(defaultProvider, "defaultProvider");
    }

    public IndentationProvider activeIndentationProvider() {
        ProviderRegistration top = providers.peekFirst();
        return top == null ? defaultProvider : top.provider;
    }

    public Registration installIndentationProvider(IndentationProvider provider) {
        ProviderRegistration registration = new ProviderRegistration(Objects.requireNonNull(provider, "provider"));
        providers.addFirst(registration);
        LOGGER.debug("Installed indentation provider {}", provider.getClass().getSimpleName());
        return registration;
    }

    public Registration addHighlightRule(HighlightRule rule) {
        RuleRegistration registration = new RuleRegistration(Objects.requireNonNull(rule, "rule"));
        highlightRules.add(registration);
        return registration;
    }

    public int highlightRuleCount() {
        return highlightRules.size();
    }

    /**
     * Runs every registered rule over the whole text and returns the spans ordered by start.
     */
    public List<HighlightSpan> highlight(CharSequence text) {
        Objects.requireNonNull(text, "text");
        List<HighlightSpan> spans = new ArrayList<>();
        for (RuleRegistration registration : List.copyOf(highlightRules)) {
            spans.addAll(registration.rule.apply(text, 0, text.length()));
        }
        spans.sort(Comparator.comparingInt(HighlightSpan::start));
        return spans;
    }

    private final class ProviderRegistration implements Registration {
        private final IndentationProvider provider;
        private boolean active = true;

        private ProviderRegistration(IndentationProvider provider) {
            this.provider = provider;
        }

        @Override
        public boolean isActive() {
            return active;
        }

        @Override
        public void close() {
            if (!active) {
                return;
            }
            active = false;
            providers.remove(this);
            LOGGER.debug("Removed indentation provider {}", provider.getClass().getSimpleName());
        }
    }

    private final class RuleRegistration implements Registration {
        private final HighlightRule rule;
        private boolean active = true;

        private RuleRegistration(HighlightRule rule) {
            this.rule = rule;
        }

        @Override
        public boolean isActive() {
            return active;
        }

        @Override
        public void close() {
            if (!active) {
                return;
            }
            active = false;
            highlightRules.remove(this);
        }
    }
}
