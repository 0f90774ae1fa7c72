package io.toolgrade.core.critic.similarity;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Word tokenizer shared by the built-in metrics.
///
/// Lowercases the input and keeps runs of two or more word characters, which matches the
/// default token pattern of common TF-IDF vectorizers. Single characters are dropped.
final class TextTokenizer {

    private static final Pattern TOKEN =
            Pattern.compile("\\b\\w\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS);

    private TextTokenizer() {}

    static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }
}
