package com.slotframe.core.adapter;

import java.util.Map;
import java.util.concurrent.CompletionStage;

/**
 * 外部框架托管的组件实例
 */
public interface FrameworkDelegate {

    /**
     * 挂载 (例如首次渲染)，完成时组件就绪
     */
    CompletionStage<Void> mount(Map<String, Object> params);

    /**
     * 卸载，对应宿主的 destroy
     */
    void unmount();

    boolean hasMethod(String methodName);

    Object invokeMethod(String methodName, Object[] args) throws Throwable;
}
