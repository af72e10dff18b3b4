package com.stockpipe.jp.data;

import com.stockpipe.jp.error.ProviderException;
import com.stockpipe.jp.model.InstrumentMeta;

import java.util.List;

public interface MetadataProvider {
    List<InstrumentMeta> fetchUniverse() throws ProviderException;
}
