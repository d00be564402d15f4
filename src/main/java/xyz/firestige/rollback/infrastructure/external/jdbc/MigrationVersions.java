package xyz.firestige.rollback.infrastructure.external.jdbc;

import java.math.BigInteger;
import java.util.Comparator;

/**
 * 迁移版本比较：纯数字按数值比较（"10" > "9"），其他按字典序
 */
final class MigrationVersions {

    static final Comparator<String> ORDER = MigrationVersions::compare;

    private MigrationVersions() {
    }

    static int compare(String a, String b) {
        if (isNumeric(a) && isNumeric(b)) {
            return new BigInteger(a).compareTo(new BigInteger(b));
        }
        return a.compareTo(b);
    }

    private static boolean isNumeric(String s) {
        return s != null && !s.isEmpty() && s.chars().allMatch(Character::isDigit);
    }
}
