package com.place.conflation.similarity;

import com.place.conflation.core.model.AttributeKind;
import com.place.conflation.core.model.PlaceRecord;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Opt-in blocking for places using two cheap keys:
 * <ul>
 *   <li><b>Name token key</b>: first token of the normalized name (e.g., {@code tok:tonys})</li>
 *   <li><b>Postal key</b>: the last five-digit token of the normalized address (e.g., {@code zip:62704})</li>
 * </ul>
 *
 * <p>Lossy: two records that clear the similarity threshold are still never scored when their
 * first tokens differ and neither address carries a shared postcode ({@code tony s pizzeria} and
 * {@code tonys pizzeria} without a zip). Use it only when that recall loss is acceptable.</p>
 */
public class PlaceBlockingKeyStrategy implements BlockingKeyStrategy {

    private static final Pattern POSTAL_CODE = Pattern.compile("\\b(\\d{5})\\b");

    @Override
    public Set<String> generateKeys(PlaceRecord record) {
        Set<String> keys = new LinkedHashSet<>();

        String name = record.normalized(AttributeKind.NAME);
        if (!name.isEmpty()) {
            int space = name.indexOf(' ');
            keys.add("tok:" + (space > 0 ? name.substring(0, space) : name));
        }

        String postal = postalCode(record.normalized(AttributeKind.ADDRESS));
        if (postal != null) {
            keys.add("zip:" + postal);
        }

        return keys;
    }

    static String postalCode(String normalizedAddress) {
        Matcher matcher = POSTAL_CODE.matcher(normalizedAddress);
        String last = null;
        while (matcher.find()) {
            last = matcher.group(1);
        }
        return last;
    }
}
