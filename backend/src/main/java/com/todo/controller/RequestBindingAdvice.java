package com.todo.controller;

import org.springframework.beans.propertyeditors.StringTrimmerEditor;
import org.springframework.web.bind.WebDataBinder;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.InitBinder;

/**
 * Binding rules shared by all controllers.
 *
 * Query strings are trimmed and blank values bind as absent, so
 * {@code ?priority=&sort_by=} means no filter and the default sort.
 */
@ControllerAdvice
public class RequestBindingAdvice {

    @InitBinder
    public void trimStrings(WebDataBinder binder) {
        binder.registerCustomEditor(String.class, new StringTrimmerEditor(true));
    }
}
