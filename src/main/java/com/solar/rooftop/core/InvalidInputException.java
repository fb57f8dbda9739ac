package com.solar.rooftop.core;

/**
 * 输入非法：图像无法解码，或配置缺失/越界
 * <p>
 * 在任何检测执行之前抛出，整次分析中止
 */
public class InvalidInputException extends IllegalArgumentException {

    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
