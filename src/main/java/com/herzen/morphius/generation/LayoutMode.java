package com.herzen.morphius.generation;

public enum LayoutMode {
    // j-th rendered question fills the j-th slot; unfilled slots' layout follows in order
    POSITIONAL,
    // each question keeps the layout segment that preceded it in the template
    SOURCE_ANCHORED
}
