package io.rowcheck.core.engine;

import io.rowcheck.core.model.FieldRule;

/** Diagnostic vocabulary for record-level failures. One message per failed record. */
final class Diagnostics {

    private Diagnostics() {
        // utility class
    }

    static String badFieldCount(int expected, int actual) {
        return "bad field count - should be " + expected + " but is: " + actual;
    }

    static String missingField(FieldRule rule, int actualCount) {
        return rule.label() + " is missing (record has " + actualCount
                + " fields) - possible parsing or delimiter error";
    }

    static String failedNumericKind(FieldRule rule, String value) {
        return failedCheck(rule, "numericKind:" + rule.numericKind().keyword(), value);
    }

    static String belowMinimum(FieldRule rule, String value) {
        return failedCheck(rule, "numericMinimum:" + rule.numericMinimum().toPlainString(), value);
    }

    static String aboveMaximum(FieldRule rule, String value) {
        return failedCheck(rule, "numericMaximum:" + rule.numericMaximum().toPlainString(), value);
    }

    private static String failedCheck(FieldRule rule, String check, String value) {
        return rule.label() + " failed " + check + " check with value: " + value;
    }
}
