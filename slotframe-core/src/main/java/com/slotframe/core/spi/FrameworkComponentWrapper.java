package com.slotframe.core.spi;

import com.slotframe.api.component.UserComponent;

import java.util.Set;

/**
 * 框架组件适配 SPI
 * <p>
 * 由外部框架集成层安装，把框架组件包装成满足宿主契约的对象：
 * 每个具名方法调用都转发给框架托管的实例，挂载细节由实现方负责。
 */
public interface FrameworkComponentWrapper {

    /**
     * @param frameworkComponent 外部框架组件引用
     * @param mandatoryMethods   必须由框架组件实现的方法
     * @param optionalMethods    框架组件可选实现的方法
     * @param debugName          调试名称
     * @return 满足宿主契约的包装对象
     */
    UserComponent wrap(Object frameworkComponent,
                       Set<String> mandatoryMethods,
                       Set<String> optionalMethods,
                       String debugName);
}
