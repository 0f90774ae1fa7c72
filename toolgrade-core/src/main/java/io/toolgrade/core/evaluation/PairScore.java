package io.toolgrade.core.evaluation;

import java.util.List;

/// Scores of pairing one expected call with one actual call.
///
/// @param score tool selection score plus the scores of every fired critic
/// @param weight tool selection weight plus the weights of every fired critic
/// @param fieldResults trace entries, tool selection first, then critics in case order
record PairScore(double score, double weight, List<FieldResult> fieldResults) {

    PairScore {
        fieldResults = List.copyOf(fieldResults);
    }
}
