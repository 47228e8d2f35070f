package com.slotframe.api.exception;

/**
 * 框架异常基类
 * <p>
 * 所有 SlotFrame 抛出的异常均为非受检异常。
 */
public class SlotException extends RuntimeException {

    public SlotException(String message) {
        super(message);
    }

    public SlotException(String message, Throwable cause) {
        super(message, cause);
    }
}
