package org.cbug.analyzer.common;

public class AnalyzerException extends RuntimeException {
    private final String subject;

    public AnalyzerException(String subject, Throwable throwable) {
        super(throwable);
        this.subject = subject;
    }

    public AnalyzerException(String subject, String message) {
        super(message);
        this.subject = subject;
    }

    /*
    the file, function or checker that was being analyzed when the exception occurred
     */
    public String getSubject() {
        return subject;
    }
}
