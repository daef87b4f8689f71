package com.scratchodds.infrastructure.scraper;

import com.scratchodds.domain.model.GameDetail;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a {@link GameDetail} from one game's detail page.
 *
 * <p>Each scalar field has its own {@link FieldChain}:
 * <ol>
 *   <li>labeled phrase over the whole page text</li>
 *   <li>label inside a table row, definition list or paragraph, value from the same element</li>
 *   <li>label on a text line, value from the same line or else the next one</li>
 * </ol>
 * The first step that yields a value wins. Prize fields come from {@link PrizeTableResolver}.
 */
@Component
public class DetailExtractor {

    static final String STRUCTURAL_SELECTOR = "table tr, dl, .game-detail, p";

    private static final Pattern TOTAL_TICKETS_PHRASE =
        Pattern.compile("There are approximately\\s+([\\d,]+)\\*?\\s+tickets", Pattern.CASE_INSENSITIVE);
    private static final Pattern GUARANTEED_PHRASE =
        Pattern.compile("Guaranteed Total Prize Amount\\s*[:=]?\\s*\\$\\s*(\\d[\\d,]*(?:\\.\\d+)?)", Pattern.CASE_INSENSITIVE);
    private static final Pattern PACK_SIZE_PHRASE =
        Pattern.compile("Pack Size\\s*[:=]?\\s*(\\d[\\d,]*)", Pattern.CASE_INSENSITIVE);
    private static final Pattern ODDS_PHRASE =
        Pattern.compile("Overall odds.{0,120}?(1\\s+in\\s+\\d[\\d,]*(?:\\.\\d+)?)", Pattern.CASE_INSENSITIVE);

    private static final Pattern COUNT_TOKEN = Pattern.compile("\\d[\\d,]*");
    private static final Pattern DOLLAR_TOKEN = Pattern.compile("\\$\\s*\\d[\\d,]*");
    private static final Pattern PACK_SIZE_SAME_LINE = Pattern.compile("pack size\\D*(\\d[\\d,]*)", Pattern.CASE_INSENSITIVE);

    private static final String PACK_SIZE_LABEL = "pack size";
    private static final String GUARANTEED_LABEL = "guaranteed";
    private static final String ODDS_LABEL = "overall odds";
    private static final String TOTAL_TICKETS_LABEL = "total tickets";

    private final PrizeTableResolver prizeTableResolver;

    private final FieldChain<Long> packSizeChain = FieldChain.<Long>named("packSize")
        .then("phrase", page -> phraseCount(page, PACK_SIZE_PHRASE))
        .then("structural", page -> structural(page, PACK_SIZE_LABEL, DetailExtractor::firstCount))
        .then("line", page -> linePair(page, PACK_SIZE_LABEL,
            line -> groupCount(PACK_SIZE_SAME_LINE.matcher(line)), DetailExtractor::firstCount));

    private final FieldChain<Double> guaranteedChain = FieldChain.<Double>named("guaranteedPrizeAmount")
        .then("phrase", page -> phraseAmount(page, GUARANTEED_PHRASE))
        .then("structural", page -> structural(page, GUARANTEED_LABEL, DetailExtractor::firstDollar))
        .then("line", page -> linePair(page, GUARANTEED_LABEL,
            DetailExtractor::firstDollar, DetailExtractor::firstDollar));

    private final FieldChain<Long> totalTicketsChain = FieldChain.<Long>named("totalTickets")
        .then("phrase", page -> phraseCount(page, TOTAL_TICKETS_PHRASE))
        .then("structural", page -> structural(page, TOTAL_TICKETS_LABEL, DetailExtractor::firstCount))
        .then("line", page -> linePair(page, TOTAL_TICKETS_LABEL,
            DetailExtractor::firstCount, DetailExtractor::firstCount));

    private final FieldChain<String> oddsChain = FieldChain.<String>named("overallOdds")
        .then("phrase", page -> phrase(page, ODDS_PHRASE).map(String::trim))
        .then("structural", page -> structural(page, ODDS_LABEL, NormalizationUtils::findOdds))
        .then("line", page -> linePair(page, ODDS_LABEL,
            NormalizationUtils::findOdds, NormalizationUtils::findOdds));

    public DetailExtractor(PrizeTableResolver prizeTableResolver) {
        this.prizeTableResolver = prizeTableResolver;
    }

    public GameDetail extract(String html) {
        PageText page = PageText.parse(html);
        TopPrize topPrize = prizeTableResolver.resolve(page.getDocument());

        return new GameDetail(
            packSizeChain.resolveOrDefault(page, 0L),
            guaranteedChain.resolveOrDefault(page, 0.0),
            totalTicketsChain.resolveOrDefault(page, 0L),
            oddsChain.resolveOrDefault(page, NormalizationUtils.ODDS_NOT_AVAILABLE),
            topPrize.amount(),
            topPrize.inGame(),
            topPrize.claimed(),
            topPrize.prizesFound()
        );
    }

    // Step 1: labeled phrase over the whole page

    private static Optional<String> phrase(PageText page, Pattern pattern) {
        Matcher matcher = pattern.matcher(page.getFlatText());
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    private static Optional<Long> phraseCount(PageText page, Pattern pattern) {
        return phrase(page, pattern).map(NormalizationUtils::parseCount).filter(v -> v > 0);
    }

    private static Optional<Double> phraseAmount(PageText page, Pattern pattern) {
        return phrase(page, pattern).map(NormalizationUtils::parseCurrency).filter(v -> v > 0);
    }

    // Step 2: label and value inside the same element

    private static <T> Optional<T> structural(PageText page, String label, Function<String, Optional<T>> extractor) {
        for (Element element : page.getDocument().select(STRUCTURAL_SELECTOR)) {
            String text = element.text();
            if (!text.toLowerCase(Locale.ROOT).contains(label)) {
                continue;
            }
            Optional<T> value = extractor.apply(text);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    // Step 3: label on a line, value on the same line or the next

    private static <T> Optional<T> linePair(PageText page, String label,
                                            Function<String, Optional<T>> sameLine,
                                            Function<String, Optional<T>> nextLine) {
        List<String> lines = page.getLines();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (!line.toLowerCase(Locale.ROOT).contains(label)) {
                continue;
            }
            Optional<T> value = sameLine.apply(line);
            if (value.isEmpty() && i + 1 < lines.size()) {
                value = nextLine.apply(lines.get(i + 1));
            }
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    // Token extractors

    private static Optional<Long> firstCount(String text) {
        return groupCount(COUNT_TOKEN.matcher(text));
    }

    private static Optional<Long> groupCount(Matcher matcher) {
        if (!matcher.find()) {
            return Optional.empty();
        }
        String token = matcher.groupCount() > 0 ? matcher.group(1) : matcher.group();
        long value = NormalizationUtils.parseCount(token);
        return value > 0 ? Optional.of(value) : Optional.empty();
    }

    private static Optional<Double> firstDollar(String text) {
        Matcher matcher = DOLLAR_TOKEN.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        double value = NormalizationUtils.parseCurrency(matcher.group());
        return value > 0 ? Optional.of(value) : Optional.empty();
    }
}
