package com.slotframe.api.component;

/**
 * 用户组件契约
 * <p>
 * 宿主扩展点接受的最终对象。具体能力（初始化、刷新等）通过额外接口显式声明，
 * 框架只做接口判断，不做形状推断。
 */
public interface UserComponent {

    /**
     * 销毁组件
     * <p>
     * 由持有者在所属上下文结束时调用，框架不跟踪实例生命周期。
     */
    default void destroy() {
    }
}
