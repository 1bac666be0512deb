package com.cascade.merge.load;

import com.cascade.merge.LayerDefinition;
import com.cascade.merge.SourceUnit;

import java.io.IOException;
import java.util.List;

/**
 * Reads the raw source units of a layer. How {@link LayerDefinition#sourceLocator()} is interpreted is up to the
 * implementation.
 */
public interface LayerSourceLoader {

    /**
     * @return the layer's units; ids are slash-separated and unique within the layer
     * @throws IOException when the layer source cannot be read; the caller fails the whole layer
     */
    List<SourceUnit> load(LayerDefinition layer) throws IOException;
}
