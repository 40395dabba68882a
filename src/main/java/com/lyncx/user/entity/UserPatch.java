package com.lyncx.user.entity;

import com.lyncx.subscription.entity.Plan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * users 文件的部分更新
 *
 * 只有呼叫過 setter 的欄位會寫入（值可以是 null）；未提到的欄位保持不變。
 * lastLogin 不在這裡設定，由 UserStore 在每次 update 時統一刷新。
 */
public class UserPatch {

    public static final String DISPLAY_NAME = "displayName";
    public static final String PHOTO_URL = "photoURL";
    public static final String PLAN = "plan";

    private final Map<String, Object> fields = new LinkedHashMap<>();

    public static UserPatch empty() {
        return new UserPatch();
    }

    public static UserPatch ofPlan(Plan plan) {
        return new UserPatch().plan(plan);
    }

    public UserPatch displayName(String displayName) {
        fields.put(DISPLAY_NAME, displayName);
        return this;
    }

    public UserPatch photoURL(String photoURL) {
        fields.put(PHOTO_URL, photoURL);
        return this;
    }

    public UserPatch plan(Plan plan) {
        fields.put(PLAN, plan);
        return this;
    }

    public Map<String, Object> getFields() {
        return Collections.unmodifiableMap(fields);
    }
}
