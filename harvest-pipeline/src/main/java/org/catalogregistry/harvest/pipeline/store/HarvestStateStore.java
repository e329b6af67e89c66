package org.catalogregistry.harvest.pipeline.store;

import org.catalogregistry.harvest.pipeline.errors.StoreUnavailableException;
import org.catalogregistry.harvest.pipeline.ir.HarvestState;

/**
 * Persistence of per-source harvest bookkeeping.
 */
public interface HarvestStateStore {

    /** The stored state of a source, or {@link HarvestState#initial(String)} if it was never harvested. */
    HarvestState loadState(String source) throws StoreUnavailableException;

    void saveState(HarvestState state) throws StoreUnavailableException;
}
