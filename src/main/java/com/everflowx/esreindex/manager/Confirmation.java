package com.everflowx.esreindex.manager;

/**
 * 开始迁移前的确认，由调用方提供（控制台交互或自动确认）
 * 
 * @author everflowx
 */
@FunctionalInterface
public interface Confirmation {
    
    Confirmation ALWAYS = prompt -> true;
    
    boolean confirm(String prompt);
}
