package com.rinkstats.domain.ports;

import com.rinkstats.domain.model.RawSource;
import com.rinkstats.domain.model.SourceKind;
import com.rinkstats.domain.model.SourceParseException;

import java.util.List;

/**
 * Parses one kind of raw payload into source-scoped records. Implementations see only their own
 * payload.
 *
 * @param <T> record type produced
 */
public interface SourceNormalizer<T> {

    /**
     * Source kinds this normalizer accepts.
     */
    List<SourceKind> kinds();

    /**
     * @throws SourceParseException when the payload does not have the expected structure
     */
    List<T> normalize(RawSource source) throws SourceParseException;
}
