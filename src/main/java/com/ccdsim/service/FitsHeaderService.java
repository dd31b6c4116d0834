package com.ccdsim.service;

import com.ccdsim.model.Effect;
import com.ccdsim.model.Flags;
import com.ccdsim.model.ParameterKey;
import com.ccdsim.model.Parameters;
import com.ccdsim.model.ValueType;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.fits.HeaderCard;
import nom.tam.util.Cursor;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads settings out of FITS headers and writes them back.
 */
public class FitsHeaderService {

    // written by nom.tam for the new HDU, never copied from the source header
    private static final Set<String> STRUCTURAL_KEYWORDS = new HashSet<>(Arrays.asList(
            "SIMPLE", "XTENSION", "BITPIX", "NAXIS", "NAXIS1", "NAXIS2", "NAXIS3", "EXTEND",
            "PCOUNT", "GCOUNT", "BSCALE", "BZERO", "END"));

    private static final int HISTORY_WIDTH = 70;

    /** Header adapter for {@link SettingResolver}; numeric cards are read with the header's typed getters. */
    public static class HeaderKeywords implements KeywordSource {

        private final Header header;

        public HeaderKeywords(Header header) {
            this.header = header;
        }

        @Override
        public boolean contains(String keyword) {
            return header.containsKey(keyword);
        }

        @Override
        public Object read(String keyword, ValueType type) {
            if (!header.containsKey(keyword)) return null;
            switch (type) {
                case INTEGER:
                    return header.getIntValue(keyword);
                case LONG:
                    return header.getLongValue(keyword);
                case DOUBLE:
                    return header.getDoubleValue(keyword);
                case BOOLEAN:
                    return header.getBooleanValue(keyword);
                default:
                    return header.getStringValue(keyword);
            }
        }
    }

    public KeywordSource keywords(Header header) {
        return header == null ? KeywordSource.empty() : new HeaderKeywords(header);
    }

    /**
     * Copies every card of {@code source} except the structural ones and those this project
     * writes itself into {@code target}.
     */
    public void copyCards(Header source, Header target) {
        if (source == null) return;
        Set<String> owned = ownedKeywords();
        Cursor<String, HeaderCard> cursor = source.iterator();
        while (cursor.hasNext()) {
            HeaderCard card = cursor.next();
            String key = card.getKey();
            if (STRUCTURAL_KEYWORDS.contains(key) || isOwned(key, owned)) continue;
            target.addLine(card);
        }
    }

    /** Writes every parameter and flag onto its primary keyword, lists as {@code KEY1..KEYn}. */
    public void writeSettings(Header header, Parameters parameters, Flags flags) throws FitsException {
        for (ParameterKey key : ParameterKey.values()) {
            String keyword = key.primaryKeyword();
            Object value = parameters.get(key);
            switch (key.valueType()) {
                case INTEGER:
                    header.addValue(keyword, ((Integer) value).intValue(), key.key());
                    break;
                case LONG:
                    header.addValue(keyword, ((Long) value).longValue(), key.key());
                    break;
                case DOUBLE:
                    header.addValue(keyword, ((Double) value).doubleValue(), key.key());
                    break;
                case DOUBLE_LIST:
                    List<?> values = (List<?>) value;
                    for (int i = 0; i < values.size(); i++) {
                        header.addValue(keyword + (i + 1), ((Double) values.get(i)).doubleValue(), key.key());
                    }
                    break;
                default:
                    header.addValue(keyword, String.valueOf(value), key.key());
                    break;
            }
        }
        for (Effect effect : Effect.values()) {
            header.addValue(effect.primaryKeyword(), flags.isPresent(effect), effect.key());
        }
    }

    public void addHistory(Header header, String command) throws FitsException {
        if (command == null) return;
        for (int start = 0; start < command.length(); start += HISTORY_WIDTH) {
            header.insertHistory(command.substring(start, Math.min(command.length(), start + HISTORY_WIDTH)));
        }
    }

    private static Set<String> ownedKeywords() {
        Set<String> owned = new HashSet<>();
        for (ParameterKey key : ParameterKey.values()) {
            if (key.valueType() != ValueType.DOUBLE_LIST) owned.add(key.primaryKeyword());
        }
        for (Effect effect : Effect.values()) owned.add(effect.primaryKeyword());
        return owned;
    }

    private static boolean isOwned(String key, Set<String> owned) {
        if (owned.contains(key)) return true;
        for (ParameterKey list : ParameterKey.values()) {
            if (list.valueType() == ValueType.DOUBLE_LIST && key.startsWith(list.primaryKeyword())
                    && key.length() > list.primaryKeyword().length()
                    && key.substring(list.primaryKeyword().length()).chars().allMatch(Character::isDigit)) {
                return true;
            }
        }
        return false;
    }
}
