package net.optspec.argparse;

import java.util.List;

/**
 * Splits a raw command line into flags, values, targets, and the rest.
 * Implementations do not validate anything; unknown flags, missing values
 * and the like are recorded for the {@link Validator} to judge.
 */
public interface Tokenizer {

    TokenizedArguments tokenize(List<String> args, DefinitionSet defs);

}
