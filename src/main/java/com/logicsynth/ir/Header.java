package com.logicsynth.ir;

import java.util.List;

/**
 * A {@code Package} or {@code Use} header with its optional metadata atoms.
 */
public record Header(String name, List<Atom> atoms) {

    public Header {
        atoms = List.copyOf(atoms);
    }
}
