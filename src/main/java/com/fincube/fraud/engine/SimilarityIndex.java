package com.fincube.fraud.engine;

import com.fincube.fraud.model.FeatureVector;
import com.fincube.fraud.model.NeighborMatch;

import java.util.List;

/**
 * Nearest-neighbor lookup over the labeled reference population.
 */
public interface SimilarityIndex {

    /**
     * @param normalizedVector query vector, normalized with the scaler the index was built with
     * @param k                maximum number of neighbors
     * @return at most k neighbors in ascending distance order; empty when the index holds no data
     */
    List<NeighborMatch> findNearest(FeatureVector normalizedVector, int k);
}
