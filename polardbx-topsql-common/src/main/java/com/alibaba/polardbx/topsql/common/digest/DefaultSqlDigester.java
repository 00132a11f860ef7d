/*
 * Copyright [2013-2021], Alibaba Group Holding Limited
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.alibaba.polardbx.topsql.common.digest;

import com.alibaba.polardbx.topsql.common.utils.Assert;
import com.google.common.base.Splitter;
import com.google.common.collect.Lists;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import org.apache.commons.lang3.StringUtils;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

/**
 * Normalizes sql by removing comments, replacing literals with '?' and
 * canonicalizing case and whitespace. Digest is sha256 of the normalized text.
 * <p>
 * e.g. {@code SELECT * FROM t WHERE id IN (1, 2, 3) AND name = 'a'} is normalized to
 * {@code select * from t where id in (...) and name = ?}
 */
public class DefaultSqlDigester implements SqlDigester {

    private static final DefaultSqlDigester INSTANCE = new DefaultSqlDigester();

    private static final HashFunction HASH_FUNCTION = Hashing.sha256();

    private static final String PLACEHOLDER = "?";

    private static final String LIST_PLACEHOLDER = "...";

    private static final String OPERATOR_CHARS = "<>=!|&:";

    public static DefaultSqlDigester getInstance() {
        return INSTANCE;
    }

    @Override
    public NormalizedText normalizeSql(String sql) {
        Assert.assertNotNull(sql, "sql");
        String normalized = render(collapseInLists(tokenize(sql)));
        return new NormalizedText(normalized, digest(normalized));
    }

    @Override
    public NormalizedText normalizePlan(String plan) {
        Assert.assertNotNull(plan, "plan");
        List<String> lines = Lists.newArrayList();
        for (String line : Splitter.on('\n').trimResults().omitEmptyStrings().split(plan)) {
            lines.add(line);
        }
        String normalized = StringUtils.join(lines, '\n');
        return new NormalizedText(normalized, digest(normalized));
    }

    private static Digest digest(String normalized) {
        return Digest.of(HASH_FUNCTION.hashString(normalized, StandardCharsets.UTF_8).asBytes());
    }

    static List<String> tokenize(String sql) {
        List<String> tokens = Lists.newArrayList();
        final int len = sql.length();
        int i = 0;
        while (i < len) {
            char c = sql.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '#' || (c == '-' && i + 1 < len && sql.charAt(i + 1) == '-')) {
                int end = sql.indexOf('\n', i);
                i = end < 0 ? len : end + 1;
            } else if (c == '/' && i + 1 < len && sql.charAt(i + 1) == '*') {
                int end = sql.indexOf("*/", i + 2);
                i = end < 0 ? len : end + 2;
            } else if (c == '\'' || c == '"') {
                i = skipQuoted(sql, i, c);
                tokens.add(PLACEHOLDER);
            } else if (c == '`') {
                int end = skipQuoted(sql, i, c);
                tokens.add(sql.substring(i, end));
                i = end;
            } else if (Character.isDigit(c)) {
                int end = i;
                while (end < len && (Character.isLetterOrDigit(sql.charAt(end)) || sql.charAt(end) == '.')) {
                    end++;
                }
                tokens.add(PLACEHOLDER);
                i = end;
            } else if (isIdentifierPart(c)) {
                int end = i;
                while (end < len && isIdentifierPart(sql.charAt(end))) {
                    end++;
                }
                tokens.add(sql.substring(i, end).toLowerCase(Locale.ROOT));
                i = end;
            } else if (OPERATOR_CHARS.indexOf(c) >= 0) {
                int end = i;
                while (end < len && OPERATOR_CHARS.indexOf(sql.charAt(end)) >= 0) {
                    end++;
                }
                tokens.add(sql.substring(i, end));
                i = end;
            } else {
                tokens.add(String.valueOf(c));
                i++;
            }
        }
        return tokens;
    }

    /**
     * @return index right after the closing quote, or the end of sql if unterminated
     */
    private static int skipQuoted(String sql, int start, char quote) {
        int i = start + 1;
        while (i < sql.length()) {
            char c = sql.charAt(i);
            if (c == '\\' && quote != '`') {
                i += 2;
            } else if (c == quote) {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    i += 2;
                } else {
                    return i + 1;
                }
            } else {
                i++;
            }
        }
        return sql.length();
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    /**
     * "in ( ? , ? , ? )" becomes "in ( ... )" so that lists of different length share one digest.
     */
    static List<String> collapseInLists(List<String> tokens) {
        List<String> result = Lists.newArrayListWithCapacity(tokens.size());
        int i = 0;
        while (i < tokens.size()) {
            String token = tokens.get(i);
            result.add(token);
            i++;
            if (!"in".equals(token) || i >= tokens.size() || !"(".equals(tokens.get(i))) {
                continue;
            }
            int end = i + 1;
            boolean onlyPlaceholders = false;
            while (end < tokens.size()) {
                if (!PLACEHOLDER.equals(tokens.get(end))) {
                    break;
                }
                onlyPlaceholders = true;
                end++;
                if (end < tokens.size() && ",".equals(tokens.get(end))) {
                    end++;
                } else {
                    break;
                }
            }
            if (onlyPlaceholders && end < tokens.size() && ")".equals(tokens.get(end))) {
                result.add("(");
                result.add(LIST_PLACEHOLDER);
                result.add(")");
                i = end + 1;
            }
        }
        return result;
    }

    static String render(List<String> tokens) {
        StringBuilder builder = new StringBuilder();
        String prev = null;
        for (String token : tokens) {
            boolean space = prev != null
                && !",".equals(token) && !")".equals(token) && !".".equals(token)
                && !"(".equals(prev) && !".".equals(prev);
            if (space) {
                builder.append(' ');
            }
            builder.append(token);
            prev = token;
        }
        return builder.toString();
    }
}
