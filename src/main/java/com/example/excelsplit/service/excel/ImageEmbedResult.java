package com.example.excelsplit.service.excel;

public record ImageEmbedResult(boolean embedded, String failureReason) {

    private static final ImageEmbedResult OK = new ImageEmbedResult(true, null);

    public static ImageEmbedResult ok() {
        return OK;
    }

    public static ImageEmbedResult failed(String reason) {
        return new ImageEmbedResult(false, reason);
    }
}
