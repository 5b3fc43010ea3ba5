package com.pharmos.prediction;

import com.pharmos.domain.ModelType;

/**
 * Computes predicted properties for a molecule. The resolver layer treats the
 * returned value bag as opaque.
 */
public interface PredictionProvider {

    /**
     * @param smiles SMILES string of the molecule
     * @param modelType model family to run
     * @throws IllegalArgumentException if {@code smiles} is blank
     */
    Prediction predict(String smiles, ModelType modelType);

    /**
     * Structural similarity of two molecules.
     *
     * @return a score in [0, 1], 1 meaning identical
     */
    double similarity(String smiles1, String smiles2);
}
