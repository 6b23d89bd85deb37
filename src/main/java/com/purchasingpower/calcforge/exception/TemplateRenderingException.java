package com.purchasingpower.calcforge.exception;

import lombok.Getter;

@Getter
public class TemplateRenderingException extends RuntimeException {

    private final String templateName;

    public TemplateRenderingException(String message, String templateName, Throwable cause) {
        super(message, cause);
        this.templateName = templateName;
    }

}
