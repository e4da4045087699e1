package com.rinkstats.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Which sources contributed to a canonical event and which data-quality markers it carries.
 */
public record EventProvenance(Set<SourceKind> sources, Integer apiEventIdx, Integer htmlEventIdx, Set<DiagnosticFlag> flags) {

    public EventProvenance {
        sources = sources == null || sources.isEmpty()
            ? Collections.emptySet()
            : Collections.unmodifiableSet(EnumSet.copyOf(sources));
        flags = flags == null || flags.isEmpty()
            ? Collections.emptySet()
            : Collections.unmodifiableSet(EnumSet.copyOf(flags));
    }

    @JsonIgnore
    public boolean isMatched() {
        return sources.contains(SourceKind.API_EVENTS) && sources.contains(SourceKind.HTML_EVENTS);
    }

    public boolean has(DiagnosticFlag flag) {
        return flags.contains(flag);
    }

    public EventProvenance withFlag(DiagnosticFlag flag) {
        EnumSet<DiagnosticFlag> updated = flags.isEmpty() ? EnumSet.noneOf(DiagnosticFlag.class) : EnumSet.copyOf(flags);
        updated.add(flag);
        return new EventProvenance(sources, apiEventIdx, htmlEventIdx, updated);
    }
}
