/*
 * どこで: Customer API
 * 何を: 顧客登録リクエストの入力を保持する
 * なぜ: JSON からのバインドと検証を明確にするため
 */
package com.example.customer.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CustomerCreateRequest(
    @NotBlank(message = "name is required") String name,
    @NotBlank(message = "email is required") @Email(message = "email is invalid") String email,
    @NotBlank(message = "user_id is required") String userId,
    List<@NotBlank(message = "tags must not contain blank values") String> tags,
    @Size(max = 512, message = "reason must be at most 512 characters") String reason) {}
