package com.slotframe.core.enums;

/**
 * 组件来源 (为何选中该实现)
 */
public enum ComponentSource {
    DEFAULT,
    REGISTERED_BY_NAME,
    HARDCODED
}
