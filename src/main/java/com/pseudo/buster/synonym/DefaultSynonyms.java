package com.pseudo.buster.synonym;

/**
 * Built-in identifier synonyms for common business-rule variables.
 */
public final class DefaultSynonyms {

    private DefaultSynonyms() {
        // Utility class
    }

    /**
     * Creates the default synonym table. Some alias lists deliberately include
     * known misspellings (e.g. {@code uset_type}) so they normalize silently.
     */
    public static SynonymTable createDefaultTable() {
        return SynonymTable.builder()
                .add("user_type", "UserType", "user_type", "type_of_user", "User_Type", "uset_type")
                .add("account_status", "ACCT_STATUS", "accountStatus", "status_of_account", "Acct_Status", "account_status")
                .add("customer_tier", "Customer_Tier", "customerTier", "tier_of_customer", "customer_tier")
                .add("purchase_amount", "purchaseAmount", "amount_of_purchase", "purchase_amount")
                .add("user_id", "user_ID", "UserId", "userId", "user_id", "ID_of_user")
                .add("current_time", "current_TIME", "CurrentTime", "currentTime", "current_time", "time_now")
                .add("user_role", "User_Role", "user_role", "role_of_user", "userRole")
                .add("item_count", "itemCount", "Item_Count", "count_of_items", "item_count")
                .add("item_weight", "item_weight", "ItemWeight", "weight_of_item", "itemWeight")
                .add("customer_rating", "customer_rating", "CustomerRating", "rating_of_customer", "customerRating")
                .add("user_status", "user_status", "UserStatus", "status_of_user", "userStatus")
                .add("is_user_admin", "is_User_Admin", "is_user_admin", "isAdmin", "IsUserAdmin")
                .build();
    }
}
