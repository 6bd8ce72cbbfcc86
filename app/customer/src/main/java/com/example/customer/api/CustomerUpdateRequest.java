/*
 * どこで: Customer API
 * 何を: 顧客更新リクエストの入力を保持する
 * なぜ: 指定されたフィールドだけを部分更新するため
 */
package com.example.customer.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.util.List;

// null のフィールドは変更しない
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CustomerUpdateRequest(
    @Pattern(regexp = ".*\\S.*", message = "name must not be blank") String name,
    @Email(message = "email is invalid") String email,
    List<String> tags,
    @Size(max = 512, message = "reason must be at most 512 characters") String reason) {}
