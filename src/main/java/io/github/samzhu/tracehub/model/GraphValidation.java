package io.github.samzhu.tracehub.model;

/**
 * Execution graph 驗證結果
 *
 * @param valid 是否通過驗證
 * @param error 未通過時的錯誤訊息
 */
public record GraphValidation(
    boolean valid,
    String error
) {
    private static final GraphValidation VALID = new GraphValidation(true, null);

    public static GraphValidation ok() {
        return VALID;
    }

    public static GraphValidation invalid(String error) {
        return new GraphValidation(false, error);
    }
}
