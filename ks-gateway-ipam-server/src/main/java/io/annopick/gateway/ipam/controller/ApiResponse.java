package io.annopick.gateway.ipam.controller;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse {
    private Object content;
    private String error;

    public static ApiResponse content(Object content) {
        return new ApiResponse(content, null);
    }

    public static ApiResponse error(String error) {
        return new ApiResponse(null, error);
    }
}
