package org.rostilos.codeinsights.schema.validation;

/**
 * Size limits enforced by Bitbucket Server for Code Insights payloads.
 */
public final class FieldLimits {

    public static final int REPORT_TITLE_MAX_LENGTH = 450;
    public static final int REPORT_DETAILS_MAX_LENGTH = 2000;
    public static final int REPORT_REPORTER_MAX_LENGTH = 450;
    public static final int REPORT_MAX_DATA_FIELDS = 6;

    public static final int ANNOTATION_MESSAGE_MAX_LENGTH = 2000;
    public static final int ANNOTATION_EXTERNAL_ID_MAX_LENGTH = 450;
    public static final int ANNOTATIONS_PER_REQUEST = 1000;

    public static final int PERCENTAGE_MIN = 0;
    public static final int PERCENTAGE_MAX = 100;

    private FieldLimits() {
    }
}
