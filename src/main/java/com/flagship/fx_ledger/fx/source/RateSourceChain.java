package com.flagship.fx_ledger.fx.source;

import com.flagship.fx_ledger.fx.FxProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Rate sources in configured priority order.
 */
@Component
@Slf4j
public class RateSourceChain {

    private final List<RateSource> ordered;

    @Autowired
    public RateSourceChain(List<RateSource> sources, FxProperties properties) {
        this(sources, properties.getFallback().getSources());
    }

    public RateSourceChain(List<RateSource> sources, List<RateSourceType> priority) {
        Map<RateSourceType, RateSource> byType = new EnumMap<>(RateSourceType.class);
        for (RateSource source : sources) {
            if (byType.putIfAbsent(source.type(), source) != null) {
                throw new IllegalStateException("Duplicate rate source for " + source.type());
            }
        }

        List<RateSource> chain = new ArrayList<>();
        for (RateSourceType type : priority) {
            RateSource source = byType.get(type);
            if (source == null) {
                throw new IllegalStateException("No rate source registered for " + type);
            }
            if (!chain.contains(source)) {
                chain.add(source);
            }
        }
        this.ordered = List.copyOf(chain);
        log.info("Rate source priority: {}", ordered.stream().map(RateSource::type).toList());
    }

    public List<RateSource> sources() {
        return ordered;
    }
}
