package com.emergencyalerts.domain.model;

import java.util.List;
import lombok.Value;

@Value
public class AlertPage {

    List<Alert> items;
    long total;
    int page;
    int pageSize;
}
