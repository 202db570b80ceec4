package com.strategymonitor.parser;

import com.strategymonitor.domain.enums.LegSide;
import com.strategymonitor.exception.UnrecognizedStrategyException;
import com.strategymonitor.parser.ParsedStrategy.ParsedLeg;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns trader shorthand into an ordered leg list.
 *
 * <p>Accepted input looks like a blotter line:
 * <pre>
 *   Avi    SFRF6 96.50/96.625/96.75 Call Fly    buy to open
 *   SFRH6 95.06/12/18 P fly vs SFRH6 95.50 P
 *   0RZ5 9712/9737 cs
 * </pre>
 * Columns are separated by a tab or two or more spaces: client, strategy, action. Only the
 * strategy column is parsed. A {@code vs} splits it in two; legs of the second half are
 * inverted.
 *
 * <p>Strikes may be written in full ({@code 96.625}), as two-digit suffixes of the first
 * strike ({@code 95.06/12/18}), glued ({@code 9712/9737}), or with the 1/16 shorthand
 * ({@code .06 -> .0625}, {@code .12 -> .125}, ...). Only strikes in (50, 200) are kept.
 *
 * <p>The shape comes from a keyword (fly, condor, straddle or {@code ^}, strangle or
 * {@code ^^}, ladder, spread/cs/ps) or, failing that, from the strike count. A description
 * whose shape cannot be determined, or whose strike count does not fit the shape, is
 * rejected with {@link UnrecognizedStrategyException}.
 *
 * <p>Tickers come out as {@code <UNDERLYING><EXPIRY><C|P> <strike> COMDTY}.
 */
@Slf4j
@Component
public class StrategyDescriptionParser {

    private static final Map<String, String> SIXTEENTH_SUFFIXES = Map.ofEntries(
            Map.entry("06", "0625"),
            Map.entry("12", "125"),
            Map.entry("18", "1875"),
            Map.entry("31", "3125"),
            Map.entry("37", "375"),
            Map.entry("43", "4375"),
            Map.entry("56", "5625"),
            Map.entry("60", "625"),
            Map.entry("62", "625"),
            Map.entry("68", "6875"),
            Map.entry("81", "8125"),
            Map.entry("87", "875"),
            Map.entry("93", "9375"));

    private static final BigDecimal MIN_STRIKE = BigDecimal.valueOf(50);
    private static final BigDecimal MAX_STRIKE = BigDecimal.valueOf(200);

    private static final String SECTOR = "COMDTY";

    private static final Pattern COLUMN_SEPARATOR = Pattern.compile("\\t+|\\s{2,}");
    private static final Pattern VS_SEPARATOR = Pattern.compile("\\s+vs\\s+", Pattern.CASE_INSENSITIVE);
    private static final Pattern UNDERLYING_EXPIRY =
            Pattern.compile("\\b([A-Z0-9]{2,4})([FGHJKMNQUVXZ]\\d)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern LEADING_PRODUCT_CODE =
            Pattern.compile("^\\s*[A-Z0-9]{2,5}\\d\\s+", Pattern.CASE_INSENSITIVE);
    private static final Pattern SLASH_SEQUENCE = Pattern.compile("(\\d{2,3}\\.?\\d{0,5}(?:/\\d{1,5}\\.?\\d{0,5})+)");
    private static final Pattern SINGLE_STRIKE = Pattern.compile("\\b(\\d{2,3}\\.?\\d{0,5})\\b");

    public ParsedStrategy parse(String description) {
        if (description == null || description.isBlank()) {
            throw new UnrecognizedStrategyException(String.valueOf(description), "description is blank");
        }

        String[] columns = COLUMN_SEPARATOR.split(description.trim());
        String client = columns.length > 1 ? columns[0] : "";
        String name = columns.length > 1 ? columns[1] : columns[0];
        String action = columns.length > 2 ? String.join(" ", Arrays.copyOfRange(columns, 2, columns.length)) : "";

        String[] halves = VS_SEPARATOR.split(name, 2);

        Matcher primaryMatch = UNDERLYING_EXPIRY.matcher(halves[0]);
        if (!primaryMatch.find()) {
            throw new UnrecognizedStrategyException(description, "no underlying and expiry code found");
        }
        String primaryPrefix = tickerPrefix(primaryMatch);

        List<ParsedLeg> legs = new ArrayList<>(legsFor(description, halves[0], primaryPrefix));

        if (halves.length == 2) {
            Matcher secondMatch = UNDERLYING_EXPIRY.matcher(halves[1]);
            String secondPrefix = secondMatch.find() ? tickerPrefix(secondMatch) : primaryPrefix;
            for (ParsedLeg leg : legsFor(description, halves[1], secondPrefix)) {
                legs.add(new ParsedLeg(leg.ticker(), leg.side().opposite(), leg.quantity()));
            }
        }

        log.debug("Parsed '{}' into {} legs", name, legs.size());
        return new ParsedStrategy(client, name, action, legs);
    }

    // ---- One half of a description ----

    private List<ParsedLeg> legsFor(String description, String part, String prefix) {
        List<BigDecimal> strikes = extractStrikes(part);
        if (strikes.isEmpty()) {
            throw new UnrecognizedStrategyException(description, "no strikes found in '" + part + "'");
        }

        String text = " " + part.toLowerCase(Locale.ROOT) + " ";
        OptionType optionType = detectOptionType(text);
        StrategyShape shape = detectShape(description, text, strikes.size());

        if (strikes.size() != shape.getStrikeCount()) {
            throw new UnrecognizedStrategyException(
                    description,
                    String.format(
                            "%s needs %d strikes but '%s' has %d",
                            shape.name().toLowerCase(Locale.ROOT),
                            shape.getStrikeCount(),
                            part,
                            strikes.size()));
        }

        List<ParsedLeg> legs = new ArrayList<>();
        switch (shape) {
            case STRADDLE -> {
                legs.add(new ParsedLeg(ticker(prefix, OptionType.CALL, strikes.get(0)), LegSide.LONG, 1));
                legs.add(new ParsedLeg(ticker(prefix, OptionType.PUT, strikes.get(0)), LegSide.LONG, 1));
            }
            case STRANGLE -> {
                legs.add(new ParsedLeg(ticker(prefix, OptionType.PUT, strikes.get(0)), LegSide.LONG, 1));
                legs.add(new ParsedLeg(ticker(prefix, OptionType.CALL, strikes.get(1)), LegSide.LONG, 1));
            }
            default -> {
                List<StrategyShape.Position> positions = shape.positions(optionType);
                for (int i = 0; i < strikes.size(); i++) {
                    StrategyShape.Position position = positions.get(i);
                    legs.add(new ParsedLeg(
                            ticker(prefix, optionType, strikes.get(i)), position.side(), position.quantity()));
                }
            }
        }
        return legs;
    }

    private OptionType detectOptionType(String text) {
        boolean put = text.contains("put") || text.contains(" p ") || text.contains(" ps ");
        boolean call = text.contains("call") || text.contains(" c ") || text.contains(" cs ");
        return put && !call ? OptionType.PUT : OptionType.CALL;
    }

    private StrategyShape detectShape(String description, String text, int strikeCount) {
        boolean broken = text.contains("broken") || text.contains("brk") || text.contains("bkn");
        if (text.contains("fly")) {
            return broken ? StrategyShape.BROKEN_FLY : StrategyShape.FLY;
        }
        if (text.contains("condor")) {
            return StrategyShape.CONDOR;
        }
        if (text.contains("strangle") || text.contains("^^")) {
            return StrategyShape.STRANGLE;
        }
        if (text.contains("straddle") || text.contains("^")) {
            return StrategyShape.STRADDLE;
        }
        if (text.contains("ladder")) {
            return StrategyShape.LADDER;
        }
        if (text.contains("spread") || text.contains(" cs ") || text.contains(" ps ")) {
            return StrategyShape.SPREAD;
        }
        return switch (strikeCount) {
            case 1 -> StrategyShape.OUTRIGHT;
            case 2 -> StrategyShape.SPREAD;
            case 3 -> StrategyShape.FLY;
            case 4 -> StrategyShape.CONDOR;
            default -> throw new UnrecognizedStrategyException(
                    description, "no shape keyword and " + strikeCount + " strikes");
        };
    }

    // ---- Strikes ----

    /** Strikes found in {@code part}, sorted ascending. */
    List<BigDecimal> extractStrikes(String part) {
        String cleaned = LEADING_PRODUCT_CODE.matcher(part).replaceFirst("");
        List<BigDecimal> strikes = new ArrayList<>();

        Matcher sequences = SLASH_SEQUENCE.matcher(cleaned);
        while (sequences.find()) {
            strikes.addAll(strikesFromSequence(sequences.group(1).split("/")));
        }

        if (strikes.isEmpty()) {
            Matcher singles = SINGLE_STRIKE.matcher(cleaned);
            while (singles.find()) {
                addIfValid(strikes, singles.group(1));
            }
        }

        strikes.sort(BigDecimal::compareTo);
        return strikes;
    }

    private List<BigDecimal> strikesFromSequence(String[] parts) {
        List<BigDecimal> strikes = new ArrayList<>();
        String first = parts[0];

        if (first.contains(".")) {
            // 106.4/106.8/107 or 95.06/12/18
            String base = first.substring(0, first.indexOf('.'));
            addIfValid(strikes, first);
            for (int i = 1; i < parts.length; i++) {
                String part = parts[i];
                if (part.contains(".")) {
                    addIfValid(strikes, part);
                } else if (part.length() <= 2) {
                    addIfValid(strikes, base + "." + part);
                } else if (part.length() == 3) {
                    addIfValid(strikes, part);
                } else {
                    addIfValid(strikes, glued(part));
                }
            }
        } else if (first.length() == 2) {
            // 95/95.06/12
            addIfValid(strikes, first);
            for (int i = 1; i < parts.length; i++) {
                String part = parts[i];
                if (part.contains(".")) {
                    addIfValid(strikes, part);
                } else if (part.length() <= 2) {
                    addIfValid(strikes, first + "." + part);
                }
            }
        } else if (first.length() == 4) {
            // 9712/9737/9750 or 9540/50/60
            if (Arrays.stream(parts).allMatch(p -> p.length() == 4)) {
                for (String part : parts) {
                    addIfValid(strikes, glued(part));
                }
            } else {
                String base = first.substring(0, 2);
                addIfValid(strikes, glued(first));
                for (int i = 1; i < parts.length; i++) {
                    if (parts[i].length() == 2) {
                        addIfValid(strikes, base + "." + parts[i]);
                    }
                }
            }
        }
        return strikes;
    }

    private static String glued(String digits) {
        return digits.substring(0, 2) + "." + digits.substring(2);
    }

    private void addIfValid(List<BigDecimal> strikes, String text) {
        BigDecimal strike = toStrike(text);
        if (strike != null && strike.compareTo(MIN_STRIKE) > 0 && strike.compareTo(MAX_STRIKE) < 0) {
            strikes.add(strike);
        }
    }

    /** Expands the 1/16 shorthand ({@code 98.06 -> 98.0625}). Returns null for non-numbers. */
    static BigDecimal toStrike(String text) {
        String expanded = text;
        int dot = text.indexOf('.');
        if (dot >= 0) {
            String suffix = SIXTEENTH_SUFFIXES.get(text.substring(dot + 1));
            if (suffix != null) {
                expanded = text.substring(0, dot) + "." + suffix;
            }
        }
        try {
            return new BigDecimal(expanded);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    // ---- Tickers ----

    private static String tickerPrefix(Matcher match) {
        return match.group(1).toUpperCase(Locale.ROOT) + match.group(2).toUpperCase(Locale.ROOT);
    }

    private static String ticker(String prefix, OptionType optionType, BigDecimal strike) {
        return prefix + optionType.getCode() + " " + formatStrike(strike) + " " + SECTOR;
    }

    /** 96.50 -> "96.5", 97 -> "97.0". */
    static String formatStrike(BigDecimal strike) {
        BigDecimal stripped = strike.stripTrailingZeros();
        if (stripped.scale() < 1) {
            stripped = stripped.setScale(1);
        }
        return stripped.toPlainString();
    }
}
