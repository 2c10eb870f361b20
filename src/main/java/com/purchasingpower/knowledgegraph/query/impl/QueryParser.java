package com.purchasingpower.knowledgegraph.query.impl;

import com.purchasingpower.knowledgegraph.query.ParsedQuery;
import com.purchasingpower.knowledgegraph.query.QueryIntent;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps a question onto one of the supported intents and pulls out the names to seed from.
 */
@Component
public class QueryParser {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE;

    private static final Pattern FUNDERS = Pattern.compile(
        "\\b(?:funds?|funded|funding|sponsors?|sponsored|finances?|financed|invest(?:s|ed)?\\s+in)\\s+(.+)$", FLAGS);
    private static final Pattern MEMBERS = Pattern.compile(
        "^\\s*who\\b.*?\\b(?:works?|worked|is\\s+employed|are\\s+employed|studies|studied|is\\s+affiliated|are\\s+affiliated)"
            + "\\s+(?:at|for|with|in)\\s+(.+)$", FLAGS);
    private static final Pattern AFFILIATIONS = Pattern.compile(
        "^\\s*where\\s+(?:does|did|do|is|was)\\s+(.+?)\\s+(?:work|works|study|studies|teach|teaches|affiliated)\\b", FLAGS);
    private static final Pattern CONNECTED = Pattern.compile(
        "\\b(?:connected|related|linked|associated)\\s+(?:to|with)\\s+(.+)$", FLAGS);

    private static final Pattern ORG_NOUNS = Pattern.compile(
        "\\b(?:organi[sz]ations?|compan(?:y|ies)|universit(?:y|ies)|institutions?|firms?|corporations?)\\b", FLAGS);
    private static final Pattern PERSON_NOUNS = Pattern.compile(
        "\\b(?:people|persons?|researchers?|employees?|scientists?|individuals?)\\b", FLAGS);
    private static final Pattern PLACE_NOUNS = Pattern.compile(
        "\\b(?:places?|locations?|cities|city|countries|country)\\b", FLAGS);

    private static final Set<String> STOP_WORDS = Set.of(
        "what", "which", "who", "whom", "whose", "where", "when", "why", "how",
        "is", "are", "was", "were", "be", "been", "do", "does", "did", "has", "have", "had",
        "the", "a", "an", "of", "to", "in", "on", "at", "for", "with", "by", "and", "or", "from",
        "about", "that", "this", "these", "those", "there", "their", "its", "it", "any", "all",
        "connected", "related", "linked", "associated", "tell", "me", "show", "find", "list");

    private static final int MAX_PHRASE_WORDS = 3;

    public ParsedQuery parse(String question) {
        String text = question.trim();

        QueryIntent intent = QueryIntent.GENERAL;
        String seedPhrase = null;
        Matcher matcher;
        if ((matcher = AFFILIATIONS.matcher(text)).find()) {
            intent = QueryIntent.AFFILIATIONS;
            seedPhrase = matcher.group(1);
        } else if ((matcher = MEMBERS.matcher(text)).find()) {
            intent = QueryIntent.MEMBERS;
            seedPhrase = matcher.group(1);
        } else if ((matcher = FUNDERS.matcher(text)).find()) {
            intent = QueryIntent.FUNDERS;
            seedPhrase = matcher.group(1);
        } else if ((matcher = CONNECTED.matcher(text)).find()) {
            intent = QueryIntent.CONNECTED;
            seedPhrase = matcher.group(1);
        }

        Set<String> terms = new LinkedHashSet<>();
        if (seedPhrase != null) {
            String phrase = cleanPhrase(seedPhrase);
            if (!phrase.isEmpty()) {
                terms.add(phrase);
            }
            terms.addAll(contentTerms(phrase));
        } else {
            terms.addAll(contentTerms(text));
        }

        return new ParsedQuery(intent, new ArrayList<>(terms), answerTypes(text, intent));
    }

    Set<String> answerTypes(String question, QueryIntent intent) {
        Set<String> types = new LinkedHashSet<>();
        if (ORG_NOUNS.matcher(question).find()) {
            types.add("ORG");
        }
        if (PERSON_NOUNS.matcher(question).find() || intent == QueryIntent.MEMBERS) {
            types.add("PERSON");
        }
        if (PLACE_NOUNS.matcher(question).find()) {
            types.add("GPE");
            types.add("LOC");
        }
        if (intent == QueryIntent.AFFILIATIONS && types.isEmpty()) {
            types.add("ORG");
        }
        return types;
    }

    /**
     * Content words and their 2 and 3 word runs, longest runs first.
     */
    List<String> contentTerms(String text) {
        String[] words = Arrays.stream(text.split("[^\\p{L}\\p{N}'&.-]+"))
            .map(word -> word.replaceAll("^[.'-]+|[.'-]+$", ""))
            .filter(word -> !word.isEmpty())
            .toArray(String[]::new);

        List<List<String>> runs = new ArrayList<>();
        List<String> current = new ArrayList<>();
        for (String word : words) {
            if (STOP_WORDS.contains(word.toLowerCase(Locale.ROOT))) {
                if (!current.isEmpty()) {
                    runs.add(current);
                    current = new ArrayList<>();
                }
            } else {
                current.add(word);
            }
        }
        if (!current.isEmpty()) {
            runs.add(current);
        }

        List<String> terms = new ArrayList<>();
        for (int size = MAX_PHRASE_WORDS; size >= 1; size--) {
            for (List<String> run : runs) {
                for (int start = 0; start + size <= run.size(); start++) {
                    String term = String.join(" ", run.subList(start, start + size));
                    if (size > 1 || term.length() > 2) {
                        terms.add(term);
                    }
                }
            }
        }
        return terms;
    }

    private static String cleanPhrase(String phrase) {
        String cleaned = phrase.trim().replaceAll("[?!.,;:]+$", "").trim();
        return cleaned.replaceFirst("(?i)^(?:the|a|an)\\s+", "").trim();
    }
}
