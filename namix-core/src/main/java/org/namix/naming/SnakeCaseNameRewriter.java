package org.namix.naming;

import java.util.Locale;
import java.util.Objects;

/**
 * 카멜케이스/파스칼케이스 이름을 스네이크케이스로 변환합니다.
 * <p>
 * 변환 예시:
 * <ul>
 *   <li>"maxLevel" → "max_level"</li>
 *   <li>"HTTPServer" → "http_server"</li>
 *   <li>"PK_OrderLine" → "pk_order_line"</li>
 *   <li>"Order Line" → "order_line"</li>
 * </ul>
 */
public class SnakeCaseNameRewriter implements NameRewriter {

    private final Locale locale;

    public SnakeCaseNameRewriter(Locale locale) {
        this.locale = Objects.requireNonNull(locale, "locale must not be null");
    }

    @Override
    public String rewriteName(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }

        StringBuilder result = new StringBuilder(name.length() + 8);
        char[] chars = name.toCharArray();

        for (int i = 0; i < chars.length; i++) {
            char current = chars[i];

            if (Character.isUpperCase(current)) {
                if (i > 0 && shouldInsertUnderscore(chars, i) && !endsWithUnderscore(result)) {
                    result.append('_');
                }
                result.append(String.valueOf(current).toLowerCase(locale));
            } else if (Character.isWhitespace(current) || current == '-') {
                // 공백/하이픈은 구분자로 취급
                if (result.length() > 0 && !endsWithUnderscore(result)) {
                    result.append('_');
                }
            } else {
                result.append(current);
            }
        }

        return result.toString();
    }

    /**
     * 다음 경우에 언더스코어 삽입:
     * <ul>
     *   <li>이전 문자가 소문자 또는 숫자인 경우 (예: "maxLevel" → "max_Level")</li>
     *   <li>연속된 대문자의 마지막이면서 다음 문자가 소문자인 경우 (예: "HTTPServer" → "HTTP_Server")</li>
     * </ul>
     */
    private boolean shouldInsertUnderscore(char[] chars, int index) {
        char prev = chars[index - 1];

        if (Character.isLowerCase(prev) || Character.isDigit(prev)) {
            return true;
        }

        if (Character.isUpperCase(prev) && index < chars.length - 1) {
            return Character.isLowerCase(chars[index + 1]);
        }

        return false;
    }

    private static boolean endsWithUnderscore(StringBuilder builder) {
        return builder.length() > 0 && builder.charAt(builder.length() - 1) == '_';
    }
}
