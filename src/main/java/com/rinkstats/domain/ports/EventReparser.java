package com.rinkstats.domain.ports;

import com.rinkstats.domain.model.SourceEvent;
import com.rinkstats.domain.model.SourceKind;

/**
 * Re-derives the parsed fields of a source event (clock, and for report events the fields read
 * from the description) after its raw text was corrected.
 */
public interface EventReparser {

    SourceKind source();

    void reparse(SourceEvent event);
}
