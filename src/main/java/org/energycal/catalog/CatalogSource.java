package org.energycal.catalog;

import java.util.Collections;
import java.util.List;

public final class CatalogSource {

    private final String name;
    private final List<ReferenceEnergy> energies;

    public CatalogSource(String name, List<ReferenceEnergy> energies) {
        this.name = name;
        this.energies = Collections.unmodifiableList(energies);
    }

    public String getName() { return name; }

    public List<ReferenceEnergy> getEnergies() { return energies; }

    @Override
    public String toString() {
        return name;
    }
}
