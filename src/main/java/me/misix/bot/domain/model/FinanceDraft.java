package me.misix.bot.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.Builder;
import me.misix.bot.domain.model.exception.DraftValidationException;

import java.math.BigDecimal;

@Builder
public record FinanceDraft(BigDecimal amount, FinanceType type, String category, String description)
        implements EntityDraft {

    public static final String DEFAULT_CATEGORY = "другое";

    public FinanceDraft {
        category = category != null && !category.isBlank() ? category.trim() : DEFAULT_CATEGORY;
    }

    @Override
    public IntentKind kind() {
        return type != null ? type.toIntentKind() : IntentKind.ADD_EXPENSE;
    }

    @Override
    public String collection() {
        return "finances";
    }

    @Override
    public void validate() {
        if (amount == null || amount.signum() <= 0) {
            throw new DraftValidationException("Finance amount must be positive");
        }
        if (type == null) {
            throw new DraftValidationException("Finance type is required");
        }
    }
}
