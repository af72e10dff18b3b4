package com.stockpipe.jp.data;

import com.stockpipe.jp.error.ProviderException;
import com.stockpipe.jp.model.InstrumentMeta;
import com.stockpipe.jp.model.PriceSeries;
import com.stockpipe.jp.model.RankedCandidate;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * External ranking service. Returned candidates are ordered best first.
 */
public interface RankingProvider {
    List<RankedCandidate> rank(
            LocalDate referenceDate,
            List<InstrumentMeta> universe,
            Map<String, PriceSeries> prices
    ) throws ProviderException;
}
