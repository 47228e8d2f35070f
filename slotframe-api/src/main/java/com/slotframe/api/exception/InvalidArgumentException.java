package com.slotframe.api.exception;

import org.jspecify.annotations.Nullable;

/**
 * 定义或注册值非法
 * <p>
 * paramName 是出错的键 (如 cellRendererSelector、overrideDefaults)；
 * 值属于某个扩展点时，propertyName 记录该扩展点，便于宿主定位是哪一列、哪个面板的配置写错了。
 */
public class InvalidArgumentException extends SlotException {

    @Nullable
    private final String propertyName;
    @Nullable
    private final String paramName;
    @Nullable
    private final Object invalidValue;

    public InvalidArgumentException(String message) {
        this(null, null, null, message, null);
    }

    public InvalidArgumentException(String paramName, String message) {
        this(null, paramName, null, message, null);
    }

    public InvalidArgumentException(String paramName, @Nullable Object invalidValue, String message) {
        this(null, paramName, invalidValue, message, null);
    }

    public InvalidArgumentException(String paramName, String message, Throwable cause) {
        this(null, paramName, null, message, cause);
    }

    private InvalidArgumentException(@Nullable String propertyName, @Nullable String paramName,
                                     @Nullable Object invalidValue, String message, @Nullable Throwable cause) {
        super(message, cause);
        this.propertyName = propertyName;
        this.paramName = paramName;
        this.invalidValue = invalidValue;
    }

    /**
     * 扩展点配置非法
     *
     * @param propertyName 扩展点，如 cellRenderer
     * @param key          扩展点下出错的键，如 cellRenderer 本身或 cellRendererSelector
     */
    public static InvalidArgumentException forProperty(String propertyName, String key,
                                                       @Nullable Object invalidValue, String message) {
        return new InvalidArgumentException(propertyName, key, invalidValue, message, null);
    }

    @Nullable
    public String getPropertyName() {
        return propertyName;
    }

    @Nullable
    public String getParamName() {
        return paramName;
    }

    @Nullable
    public Object getInvalidValue() {
        return invalidValue;
    }
}
