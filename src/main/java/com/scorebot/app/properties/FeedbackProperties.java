package com.scorebot.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "feedback")
public class FeedbackProperties {
    private int maturityDays = 10;
    private int batchLimit = 200;
}
