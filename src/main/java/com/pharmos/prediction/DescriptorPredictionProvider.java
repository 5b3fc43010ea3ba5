package com.pharmos.prediction;

import com.pharmos.domain.ModelType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Demo provider deriving pseudo-properties from character counts of the SMILES
 * string. Deterministic: the same SMILES and model type always give the same result.
 */
@Component
public class DescriptorPredictionProvider implements PredictionProvider {
    private static final Logger logger = LoggerFactory.getLogger(DescriptorPredictionProvider.class);

    public static final String MODEL_VERSION = "descriptor-1.0";

    private static final String ATOM_SYMBOLS = "CNOSPFLBRI";
    private static final String HETERO_SYMBOLS = "NOSPFLBRI";

    @Override
    public Prediction predict(String smiles, ModelType modelType) {
        if (smiles == null || smiles.isBlank()) {
            throw new IllegalArgumentException("SMILES must not be blank");
        }
        Descriptors d = Descriptors.of(smiles);
        Random noise = new Random(smiles.hashCode() * 31L + modelType.ordinal());

        Map<String, Object> values = new LinkedHashMap<>();
        values.put("atom_count", d.atoms);
        values.put("ring_count", d.rings);
        values.put("double_bonds", d.doubleBonds);
        values.put("heteroatoms", d.heteroatoms);

        switch (modelType) {
            case TOXICITY:
                double toxicity = clamp(0.1 + d.heteroatoms * 0.04 + d.doubleBonds * 0.02
                    + noise.nextGaussian() * 0.05, 0, 1);
                values.put("toxicity_score", round(toxicity));
                values.put("risk_level", toxicity > 0.6 ? "high" : toxicity > 0.3 ? "medium" : "low");
                break;
            case ADMET:
                values.put("absorption", round(clamp(0.9 - d.complexity() * 0.005, 0, 1)));
                values.put("distribution", round(clamp(0.5 + d.rings * 0.05, 0, 1)));
                values.put("metabolism", round(clamp(0.4 + d.heteroatoms * 0.03, 0, 1)));
                values.put("excretion", round(clamp(0.6 - d.atoms * 0.005, 0, 1)));
                values.put("bbb_permeant", d.heteroatoms < 5);
                break;
            case EFFICACY:
                values.put("efficacy_score", round(clamp(0.4 + d.rings * 0.08 + noise.nextGaussian() * 0.05, 0, 1)));
                break;
            case BINDING_AFFINITY:
                values.put("pic50", round(clamp(4 + d.rings * 0.6 + d.heteroatoms * 0.1 + noise.nextGaussian() * 0.3, 0, 12)));
                break;
            case SOLUBILITY:
                values.put("log_s", round(clamp(-d.complexity() * 0.1 + noise.nextGaussian() * 0.5 - 1, -10, 2)));
                break;
            default:
                throw new IllegalArgumentException("Unsupported model type: " + modelType);
        }

        double confidence = round(clamp(0.7 + noise.nextGaussian() * 0.1, 0.5, 0.95));
        logger.debug("Predicted {} for {} with confidence {}", modelType, smiles, confidence);
        return new Prediction(values, confidence, MODEL_VERSION);
    }

    /**
     * Jaccard index of the two strings' character sets.
     */
    @Override
    public double similarity(String smiles1, String smiles2) {
        Set<Character> first = characters(smiles1);
        Set<Character> second = characters(smiles2);
        Set<Character> union = new HashSet<>(first);
        union.addAll(second);
        if (union.isEmpty()) {
            return 0.0;
        }
        Set<Character> intersection = new HashSet<>(first);
        intersection.retainAll(second);
        return (double) intersection.size() / union.size();
    }

    private static Set<Character> characters(String smiles) {
        Set<Character> chars = new HashSet<>();
        if (smiles != null) {
            for (char c : smiles.toCharArray()) {
                chars.add(c);
            }
        }
        return chars;
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    private static double round(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }

    /**
     * Character-count descriptors of a SMILES string.
     */
    static final class Descriptors {
        final int atoms;
        final int rings;
        final int doubleBonds;
        final int heteroatoms;

        private Descriptors(int atoms, int rings, int doubleBonds, int heteroatoms) {
            this.atoms = atoms;
            this.rings = rings;
            this.doubleBonds = doubleBonds;
            this.heteroatoms = heteroatoms;
        }

        static Descriptors of(String smiles) {
            int atoms = 0;
            int doubleBonds = 0;
            int heteroatoms = 0;
            Set<Character> ringDigits = new HashSet<>();
            for (char c : smiles.toCharArray()) {
                char upper = Character.toUpperCase(c);
                if (Character.isLetter(c) && ATOM_SYMBOLS.indexOf(upper) >= 0) {
                    atoms++;
                }
                if (HETERO_SYMBOLS.indexOf(upper) >= 0) {
                    heteroatoms++;
                }
                if (Character.isDigit(c)) {
                    ringDigits.add(c);
                }
                if (c == '=') {
                    doubleBonds++;
                }
            }
            return new Descriptors(atoms, ringDigits.size(), doubleBonds, heteroatoms);
        }

        double complexity() {
            return (atoms + rings + doubleBonds + heteroatoms) * 1.5;
        }
    }
}
