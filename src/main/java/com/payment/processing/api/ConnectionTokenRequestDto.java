package com.payment.processing.api;

import lombok.Data;

@Data
public class ConnectionTokenRequestDto {

    private String locationId;
}
