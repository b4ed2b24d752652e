package com.jobtailor.common.exception;

/**
 * 职位抓取异常（抓取后端未接入、站点请求失败等）。
 */
public class JobScrapingException extends JobTailorException {

    public JobScrapingException(String message) {
        super("SCRAPE_ERROR", message);
    }

    public JobScrapingException(String message, Throwable cause) {
        super("SCRAPE_ERROR", message, cause);
    }
}
