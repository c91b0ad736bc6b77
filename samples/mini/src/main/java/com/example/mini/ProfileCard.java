package com.example.mini;

import android.content.Context;
import android.util.AttributeSet;
import android.view.View;
import android.widget.FrameLayout;

public class ProfileCard extends FrameLayout {

    public ProfileCard(Context context, AttributeSet attrs) {
        super(context, attrs);
        View.inflate(context, R.layout.view_profile_card, this);
    }
}
